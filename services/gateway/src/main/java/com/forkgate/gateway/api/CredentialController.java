package com.forkgate.gateway.api;

import com.forkgate.gateway.infrastructure.web.RejectionStatus;
import com.forkgate.security.AccessResolution;
import com.forkgate.security.CredentialIssuer;
import com.forkgate.security.IssuanceResult;
import com.forkgate.security.RejectionReason;
import com.forkgate.security.Tier;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Credential issuance. Only administrators may call it, and only developer and basic credentials
 * can be issued. Every refusal is answered as {@code {"error_message": ...}}.
 *
 * <p>The caller is resolved and authorized before the body is validated, so a caller who may not
 * issue credentials is refused the same way whatever the body holds.
 */
@RestController
@RequestMapping("/api/v1")
public class CredentialController {

    private static final Logger log = LoggerFactory.getLogger(CredentialController.class);

    private final CallerAccess callerAccess;
    private final CredentialIssuer issuer;
    private final Validator validator;

    public CredentialController(
            CallerAccess callerAccess, CredentialIssuer issuer, Validator validator) {
        this.callerAccess = callerAccess;
        this.issuer = issuer;
        this.validator = validator;
    }

    @PostMapping("/keys")
    public ResponseEntity<IssueCredentialResponse> issue(
            @RequestBody(required = false) IssueCredentialRequest body,
            HttpServletRequest request) {
        AccessResolution caller = callerAccess.resolve(request);
        if (!caller.isGranted()) {
            return refuse(caller.rejection());
        }
        if (caller.tier() != Tier.ADMINISTRATOR) {
            log.warn("Issuance refused for caller tier {}", caller.tier());
            return refuse(RejectionReason.NOT_AUTHORIZED);
        }

        String invalid = validate(body);
        if (invalid != null) {
            return ResponseEntity.badRequest().body(IssueCredentialResponse.error(invalid));
        }

        Tier requested = Tier.fromWireName(body.accessLevel()).orElse(null);
        IssuanceResult result = issuer.issue(requested, body.label(), caller.tier());
        if (!result.isIssued()) {
            return refuse(result.rejection());
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(IssueCredentialResponse.issued(result.credential()));
    }

    /** Violations as {@code "field: message"} pairs in field order, null when the body is valid. */
    private String validate(IssueCredentialRequest body) {
        if (body == null) {
            return "request body is required";
        }
        Set<ConstraintViolation<IssueCredentialRequest>> violations = validator.validate(body);
        if (violations.isEmpty()) {
            return null;
        }
        return violations.stream()
                .map(v -> wireName(v.getPropertyPath().toString()) + ": " + v.getMessage())
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.joining("; "));
    }

    private static String wireName(String property) {
        return property.replaceAll("([A-Z])", "_$1").toLowerCase(Locale.ROOT);
    }

    private static ResponseEntity<IssueCredentialResponse> refuse(RejectionReason reason) {
        return ResponseEntity.status(RejectionStatus.of(reason))
                .headers(RejectionStatus.headers(reason))
                .body(IssueCredentialResponse.error(reason.message()));
    }
}
