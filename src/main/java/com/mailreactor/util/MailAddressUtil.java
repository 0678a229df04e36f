package com.mailreactor.util;

import java.util.Locale;

/**
 * Email address helpers
 */
public final class MailAddressUtil {

    private MailAddressUtil() {}

    /**
     * Strip angle brackets (<>) from an email address
     */
    public static String stripAngleBrackets(String email) {
        if (email == null) return null;
        String stripped = email.trim();
        if (stripped.startsWith("<")) stripped = stripped.substring(1);
        if (stripped.endsWith(">")) stripped = stripped.substring(0, stripped.length() - 1);
        return stripped.trim();
    }

    /**
     * Canonical account key: brackets stripped, trimmed, lower case.
     * Returns null when the value is not of the form local@domain.
     */
    public static String normalize(String email) {
        String stripped = stripAngleBrackets(email);
        if (stripped == null) return null;
        int at = stripped.lastIndexOf('@');
        if (at <= 0 || at == stripped.length() - 1 || stripped.chars().anyMatch(Character::isWhitespace)) {
            return null;
        }
        return stripped.toLowerCase(Locale.ROOT);
    }

    /**
     * Extract domain from an email address
     */
    public static String extractDomain(String email) {
        if (email == null || !email.contains("@")) return null;
        return stripAngleBrackets(email.substring(email.lastIndexOf('@') + 1)).toLowerCase(Locale.ROOT);
    }

    /**
     * Extract local part from an email address
     */
    public static String extractLocalPart(String email) {
        if (email == null || !email.contains("@")) return email;
        return email.substring(0, email.lastIndexOf('@'));
    }
}
