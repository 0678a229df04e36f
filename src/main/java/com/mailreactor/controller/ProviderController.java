package com.mailreactor.controller;

import com.mailreactor.domain.ProviderProfile;
import com.mailreactor.provider.ProviderProfileResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider auto-configuration lookup.
 * GET /api/providers?email=user@gmail.com shows the settings an account of that domain would use.
 */
@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
public class ProviderController {

    private final ProviderProfileResolver profileResolver;

    @GetMapping
    public ResponseEntity<Map<String, Object>> resolve(@RequestParam("email") String email) {
        if (!email.contains("@")) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("status", "error");
            error.put("kind", GatewayExceptionHandler.VALIDATION_KIND);
            error.put("message", "Invalid email format.");
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
        }
        ProviderProfile profile = profileResolver.resolve(email);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("email", email);
        response.put("resolved", profile.isResolved());
        response.put("provider", profile.getId());
        response.put("imap", AccountController.endpoint(profile.getImap()));
        response.put("smtp", AccountController.endpoint(profile.getSmtp()));
        return ResponseEntity.ok(response);
    }
}
