package com.mailreactor.controller;

import com.mailreactor.domain.TlsMode;
import com.mailreactor.error.GatewayException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed access to loosely typed JSON request bodies
 */
final class RequestValues {

    private RequestValues() {}

    static String string(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null) return null;
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Content exactly as sent; null when absent or empty
     */
    static String content(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null) return null;
        String text = String.valueOf(value);
        return text.isEmpty() ? null : text;
    }

    static Integer integer(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null) return null;
        if (value instanceof Number number) return number.intValue();
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw GatewayException.configuration(null, key + " must be a number");
        }
    }

    static TlsMode tlsMode(Map<String, Object> body, String key) {
        String value = string(body, key);
        if (value == null) return null;
        try {
            return TlsMode.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw GatewayException.configuration(null, key + " must be one of SSL, STARTTLS, NONE");
        }
    }

    /**
     * A list of strings, or a single comma separated string
     */
    static List<String> addresses(Map<String, Object> body, String key) {
        Object value = body.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !String.valueOf(item).isBlank()) {
                    result.add(String.valueOf(item).trim());
                }
            }
        } else if (value != null) {
            for (String item : String.valueOf(value).split(",")) {
                if (!item.isBlank()) {
                    result.add(item.trim());
                }
            }
        }
        return result;
    }
}
