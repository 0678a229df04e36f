package com.mailreactor.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MX based provider detection tests
 */
class MxProviderLookupTest {

    @Test
    @DisplayName("Google Workspace MX -> gmail profile")
    void testDetect_GoogleWorkspace() {
        MxProviderLookup lookup = new MxProviderLookup(domain -> List.of("aspmx.l.google.com", "alt1.aspmx.l.google.com"));

        assertThat(lookup.detect("corp.test")).hasValueSatisfying(profile ->
                assertThat(profile.getId()).isEqualTo("gmail"));
    }

    @Test
    @DisplayName("Microsoft 365 MX -> outlook profile")
    void testDetect_Microsoft365() {
        MxProviderLookup lookup = new MxProviderLookup(domain -> List.of("corp-test.mail.protection.outlook.com"));

        assertThat(lookup.detect("corp.test")).hasValueSatisfying(profile ->
                assertThat(profile.getId()).isEqualTo("outlook"));
    }

    @Test
    @DisplayName("Self-hosted MX or no records -> empty")
    void testDetect_Unknown() {
        assertThat(new MxProviderLookup(domain -> List.of("mx.corp.test")).detect("corp.test")).isEmpty();
        assertThat(new MxProviderLookup(domain -> List.of()).detect("corp.test")).isEmpty();
        assertThat(new MxProviderLookup(domain -> List.of("notgoogle.com")).detect("corp.test")).isEmpty();
    }
}
