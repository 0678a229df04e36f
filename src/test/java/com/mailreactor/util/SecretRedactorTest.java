package com.mailreactor.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Secret redaction tests
 */
class SecretRedactorTest {

    @Test
    @DisplayName("Plain secret is masked")
    void testRedact_Plain() {
        assertThat(SecretRedactor.redact("LOGIN alice hunter2", "hunter2")).isEqualTo("LOGIN alice ******");
    }

    @Test
    @DisplayName("Base64 encoded secret (SASL) is masked")
    void testRedact_Base64() {
        String encoded = Base64.getEncoder().encodeToString("hunter2".getBytes(StandardCharsets.UTF_8));

        assertThat(SecretRedactor.redact("AUTH PLAIN " + encoded, "hunter2")).isEqualTo("AUTH PLAIN ******");
    }

    @Test
    @DisplayName("XOAUTH2 initial response carrying the token is masked")
    void testRedact_Xoauth2() {
        String payload = "user=alice@gmail.com\u0001auth=Bearer ya29.token-value\u0001\u0001";
        String encoded = Base64.getEncoder().encodeToString(payload.getBytes(StandardCharsets.UTF_8));

        String redacted = SecretRedactor.redact("AUTHENTICATE XOAUTH2 " + encoded + " failed", "ya29.token-value");

        assertThat(redacted).isEqualTo("AUTHENTICATE XOAUTH2 ****** failed");
    }

    @Test
    @DisplayName("SASL PLAIN response carrying the password is masked")
    void testRedact_SaslPlain() {
        String encoded = Base64.getEncoder().encodeToString(
                "\u0000alice@example.com\u0000hunter2".getBytes(StandardCharsets.UTF_8));

        assertThat(SecretRedactor.redact("AUTH PLAIN " + encoded, "hunter2")).isEqualTo("AUTH PLAIN ******");
    }

    @Test
    @DisplayName("Unrelated words and Base64 tokens are left alone")
    void testRedact_Unrelated() {
        String encoded = Base64.getEncoder().encodeToString("nothing secret here".getBytes(StandardCharsets.UTF_8));
        String text = "Authentication failed for mailbox " + encoded;

        assertThat(SecretRedactor.redact(text, "hunter2")).isEqualTo(text);
    }

    @Test
    @DisplayName("Null or empty input is returned unchanged")
    void testRedact_NullSafe() {
        assertThat(SecretRedactor.redact(null, "hunter2")).isNull();
        assertThat(SecretRedactor.redact("text", null)).isEqualTo("text");
        assertThat(SecretRedactor.redact("text", "")).isEqualTo("text");
    }
}
