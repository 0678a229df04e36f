package com.mailreactor.controller;

import com.mailreactor.error.GatewayErrorKind;
import com.mailreactor.error.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps gateway error kinds onto HTTP status codes and the JSON error body
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    static final String VALIDATION_KIND = GatewayErrorKind.CONFIGURATION.name();

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGatewayException(GatewayException e) {
        return errorResponse(statusOf(e.getKind()), e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.debug("Rejected request: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, VALIDATION_KIND, "Malformed request.");
    }

    static HttpStatus statusOf(GatewayErrorKind kind) {
        switch (kind) {
            case AUTHENTICATION:
                return HttpStatus.UNAUTHORIZED;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFIGURATION:
                return HttpStatus.BAD_REQUEST;
            case CONNECTION:
            case PROTOCOL:
                return HttpStatus.BAD_GATEWAY;
            case TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String kind, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("kind", kind);
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
