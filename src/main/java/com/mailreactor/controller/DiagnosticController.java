package com.mailreactor.controller;

import com.mailreactor.config.GatewayProperties;
import com.mailreactor.service.GatewayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway diagnostic endpoint for troubleshooting sessions.
 * Hit GET /api/diagnostic to see effective settings and the session state of every account.
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
@RequiredArgsConstructor
public class DiagnosticController {

    private final GatewayProperties properties;
    private final GatewayService gatewayService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> diagnostic() {
        Map<String, Object> result = new LinkedHashMap<>();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("operationTimeoutMs", properties.getOperationTimeoutMs());
        config.put("reconnectMaxAttempts", properties.getReconnect().getMaxAttempts());
        config.put("reconnectBaseDelayMs", properties.getReconnect().getBaseDelayMs());
        config.put("reconnectMaxDelayMs", properties.getReconnect().getMaxDelayMs());
        config.put("maxResultsLimit", properties.getQuery().getMaxResultsLimit());
        config.put("mxLookupEnabled", properties.getProvider().isMxLookupEnabled());
        config.put("monitorEnabled", properties.getMonitor().isEnabled());
        result.put("config", config);

        Map<String, Object> sessions = new LinkedHashMap<>();
        gatewayService.sessionStates().forEach((email, state) -> sessions.put(email, state.name()));
        result.put("sessions", sessions);

        log.info("Diagnostic check performed");
        return result;
    }
}
