package com.mailreactor.controller;

import com.mailreactor.domain.AccountCredentials;
import com.mailreactor.domain.ProviderProfile;
import com.mailreactor.domain.SecretType;
import com.mailreactor.domain.ServerEndpoint;
import com.mailreactor.domain.TlsMode;
import com.mailreactor.error.GatewayException;
import com.mailreactor.service.GatewayService;
import com.mailreactor.session.SessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Account management REST API
 * - Add account (POST /api/accounts)
 * - Remove account (DELETE /api/accounts/{email})
 * - List accounts (GET /api/accounts)
 * - Rotate secret (PUT /api/accounts/{email}/secret)
 * - Session status (GET /api/accounts/{email}/status)
 * - List folders (GET /api/accounts/{email}/folders)
 */
@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final GatewayService gatewayService;

    /**
     * Add account
     * POST /api/accounts
     * Body: { "email": "user@gmail.com", "secret": "app-password", "secretType": "PASSWORD",
     *         "imapHost": ..., "imapPort": 993, "imapTls": "SSL", "smtpHost": ..., "smtpPort": 587, "smtpTls": "STARTTLS" }
     * Server settings are optional for known providers.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> addAccount(@RequestBody Map<String, Object> request) {
        String email = RequestValues.string(request, "email");
        String secret = RequestValues.string(request, "secret");
        if (secret == null) {
            secret = RequestValues.string(request, "password");
        }

        // Required field validation
        if (email == null) {
            return errorResponse(HttpStatus.BAD_REQUEST, "email is required.");
        }
        if (secret == null) {
            return errorResponse(HttpStatus.BAD_REQUEST, "secret is required.");
        }

        AccountCredentials registered = gatewayService.addAccount(AccountCredentials.builder()
                .email(email)
                .secret(secret)
                .secretType(secretType(request))
                .profile(explicitProfile(request))
                .build());
        log.info("Account added via API: {}", registered.getEmail());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Account added.");
        response.putAll(describe(registered));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Remove account (idempotent)
     * DELETE /api/accounts/{email}
     */
    @DeleteMapping("/{email}")
    public ResponseEntity<Map<String, Object>> removeAccount(@PathVariable String email) {
        gatewayService.removeAccount(email);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Account removed.");
        response.put("email", email);
        return ResponseEntity.ok(response);
    }

    /**
     * List accounts
     * GET /api/accounts
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listAccounts() {
        List<Map<String, Object>> accounts = gatewayService.listAccounts().stream()
                .map(this::describe)
                .collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", accounts.size());
        response.put("accounts", accounts);
        return ResponseEntity.ok(response);
    }

    /**
     * Rotate secret
     * PUT /api/accounts/{email}/secret
     * Body: { "secret": "new-secret", "secretType": "OAUTH2_TOKEN" }
     */
    @PutMapping("/{email}/secret")
    public ResponseEntity<Map<String, Object>> rotateSecret(@PathVariable String email,
                                                            @RequestBody Map<String, Object> request) {
        String secret = RequestValues.string(request, "secret");
        if (secret == null) {
            return errorResponse(HttpStatus.BAD_REQUEST, "secret is required.");
        }
        gatewayService.rotateSecret(email, secret, secretType(request));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Secret updated.");
        response.put("email", email);
        return ResponseEntity.ok(response);
    }

    /**
     * Session status
     * GET /api/accounts/{email}/status
     */
    @GetMapping("/{email}/status")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String email) {
        SessionState state = gatewayService.sessionState(email);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("email", email);
        response.put("session", state.name());
        return ResponseEntity.ok(response);
    }

    /**
     * List folders
     * GET /api/accounts/{email}/folders
     */
    @GetMapping("/{email}/folders")
    public ResponseEntity<Map<String, Object>> listFolders(@PathVariable String email) {
        List<String> folders = gatewayService.listFolders(email);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", folders.size());
        response.put("folders", folders);
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> describe(AccountCredentials credentials) {
        ProviderProfile profile = credentials.getProfile();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("email", credentials.getEmail());
        map.put("secretType", credentials.getSecretType().name());
        map.put("provider", profile.getId());
        map.put("imap", endpoint(profile.getImap()));
        map.put("smtp", endpoint(profile.getSmtp()));
        return map;
    }

    static Map<String, Object> endpoint(ServerEndpoint endpoint) {
        if (endpoint == null) {
            return null;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("host", endpoint.getHost());
        map.put("port", endpoint.getPort());
        map.put("tls", endpoint.getTls().name());
        return map;
    }

    private static SecretType secretType(Map<String, Object> request) {
        String value = RequestValues.string(request, "secretType");
        if (value == null) {
            return SecretType.PASSWORD;
        }
        try {
            return SecretType.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw GatewayException.configuration(null, "secretType must be PASSWORD or OAUTH2_TOKEN");
        }
    }

    /**
     * Explicit server settings; endpoints left out of the request are filled from the provider table
     */
    private static ProviderProfile explicitProfile(Map<String, Object> request) {
        ServerEndpoint imap = endpoint(request, "imap", 993, TlsMode.SSL);
        ServerEndpoint smtp = endpoint(request, "smtp", 587, TlsMode.STARTTLS);
        if (imap == null && smtp == null) {
            return null;
        }
        return ProviderProfile.builder().imap(imap).smtp(smtp).build();
    }

    private static ServerEndpoint endpoint(Map<String, Object> request, String prefix, int defaultPort,
                                           TlsMode defaultTls) {
        String host = RequestValues.string(request, prefix + "Host");
        if (host == null) {
            return null;
        }
        Integer port = RequestValues.integer(request, prefix + "Port");
        TlsMode tls = RequestValues.tlsMode(request, prefix + "Tls");
        return ServerEndpoint.of(host, port != null ? port : defaultPort, tls != null ? tls : defaultTls);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("kind", GatewayExceptionHandler.VALIDATION_KIND);
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
