package com.forkgate.gateway.infrastructure.web;

import com.forkgate.observability.CorrelationContextHolder;
import com.forkgate.security.RejectionReason;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://forkgate.dev/errors/unrecognized-credential",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "credential not recognized",
 *   "reason": "UNRECOGNIZED_CREDENTIAL",
 *   "retryable": false,
 *   "timestamp": "2026-03-02T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>A bad request never takes the process down: anything unexpected becomes a 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://forkgate.dev/errors/";

    @ExceptionHandler(AccessRejectedException.class)
    public ResponseEntity<ProblemDetail> handleAccessRejected(AccessRejectedException ex) {
        RejectionReason reason = ex.reason();
        HttpStatus status = RejectionStatus.of(reason);
        log.info("Access rejected: {}", reason);

        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, reason.message());
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + slug(reason)));
        problem.setProperty("reason", reason.name());
        problem.setProperty("retryable", reason.retryable());
        enrichWithCorrelation(problem);
        return ResponseEntity.status(status).headers(RejectionStatus.headers(reason)).body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.BAD_REQUEST, "Request body is missing or not valid JSON");
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Spring MVC's own failures (unknown path, wrong method, bad media type)
            log.debug("Request failed: {}", ex.getMessage());
            ProblemDetail problem = errorResponse.getBody();
            enrichWithCorrelation(problem);
            return problem;
        }
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }

    private static String slug(RejectionReason reason) {
        return reason.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
