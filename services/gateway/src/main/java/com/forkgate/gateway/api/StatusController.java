package com.forkgate.gateway.api;

import com.forkgate.gateway.domain.AdmissionGateway;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Plain-text usage counters. Open to everyone; each call is itself counted. */
@RestController
@RequestMapping("/api/v1")
public class StatusController {

    private final AdmissionGateway gateway;

    public StatusController(AdmissionGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping(path = "/status", produces = MediaType.TEXT_PLAIN_VALUE)
    public String status() {
        return gateway.status();
    }
}
