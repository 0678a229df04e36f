package com.mailreactor.util;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrubs account secrets from text bound for logs or API responses
 */
public final class SecretRedactor {

    public static final String MASK = "******";

    /** Candidate Base64 tokens, e.g. SASL PLAIN or XOAUTH2 initial responses */
    private static final Pattern BASE64_TOKEN = Pattern.compile("[A-Za-z0-9+/]{8,}={0,2}");

    private SecretRedactor() {}

    /**
     * Replace every occurrence of the secret with a mask: plain, Base64 encoded, or inside a
     * Base64 encoded SASL payload such as {@code user=..^Aauth=Bearer <token>^A^A}
     */
    public static String redact(String text, String secret) {
        if (text == null || secret == null || secret.isEmpty()) {
            return text;
        }
        String redacted = text.replace(secret, MASK);
        String encoded = Base64.getEncoder().encodeToString(secret.getBytes(StandardCharsets.UTF_8));
        redacted = redacted.replace(encoded, MASK);

        Matcher matcher = BASE64_TOKEN.matcher(redacted);
        return matcher.replaceAll(match -> Matcher.quoteReplacement(
                decodesToSecret(match.group(), secret) ? MASK : match.group()));
    }

    private static boolean decodesToSecret(String token, String secret) {
        if (token.length() % 4 != 0) {
            return false;
        }
        try {
            byte[] decoded = Base64.getDecoder().decode(token);
            return new String(decoded, StandardCharsets.UTF_8).contains(secret);
        } catch (IllegalArgumentException e) {
            // not Base64 after all
            return false;
        }
    }
}
