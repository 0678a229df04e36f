package com.mailreactor.domain;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.With;

/**
 * Account identity and secret. Identity key is the email address.
 * Immutable; a rotated secret produces a new instance.
 */
@Value
@With
@Builder(toBuilder = true)
public class AccountCredentials {

    String email;

    @ToString.Exclude
    String secret;

    @Builder.Default
    SecretType secretType = SecretType.PASSWORD;

    /** Explicit or resolved connection parameters; may be unresolved on input. */
    ProviderProfile profile;
}
