package com.forkgate.gateway.api;

import com.forkgate.gateway.domain.AdmissionGateway;
import com.forkgate.gateway.domain.ExecutionReport;
import com.forkgate.gateway.domain.ExecutionRequest;
import com.forkgate.security.Tier;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Execution endpoints. Both resolve the caller's tier first; a rejected caller gets a problem
 * response and the engine is never invoked.
 */
@RestController
@RequestMapping("/api/v1")
public class ExecutionController {

    private final CallerAccess callerAccess;
    private final AdmissionGateway gateway;

    public ExecutionController(CallerAccess callerAccess, AdmissionGateway gateway) {
        this.callerAccess = callerAccess;
        this.gateway = gateway;
    }

    /** Runs a program under the caller's budget and returns the full trace. */
    @PostMapping(
            path = "/request_interpretation",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> interpret(
            @Valid @RequestBody InterpretationRequest body, HttpServletRequest request) {
        Tier tier = callerAccess.requireTier(request);
        ExecutionReport report =
                gateway.handle(ExecutionRequest.of(body.instructions(), body.input()), tier);
        // body is pre-serialized so its byte length could be metered
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(report.body());
    }

    /** The budget the caller would run under. */
    @GetMapping(path = "/limits", produces = MediaType.APPLICATION_JSON_VALUE)
    public LimitsResponse limits(HttpServletRequest request) {
        Tier tier = callerAccess.requireTier(request);
        return LimitsResponse.from(gateway.limits(tier));
    }
}
