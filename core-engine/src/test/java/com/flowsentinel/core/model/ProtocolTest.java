package com.flowsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Protocol}.
 */
class ProtocolTest {

    @Test
    @DisplayName("Should map known protocol names to IANA codes")
    void shouldMapKnownNames() {
        assertThat(Protocol.fromName("TCP").code()).isEqualTo(6);
        assertThat(Protocol.fromName("UDP").code()).isEqualTo(17);
        assertThat(Protocol.fromName("ICMP").code()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should match protocol names case-insensitively")
    void shouldIgnoreCase() {
        assertThat(Protocol.fromName("tcp")).isEqualTo(Protocol.TCP);
        assertThat(Protocol.fromName(" Udp ")).isEqualTo(Protocol.UDP);
    }

    @Test
    @DisplayName("Should map unknown, blank and null names to OTHER with code 0")
    void shouldMapUnknownToOther() {
        assertThat(Protocol.fromName("SCTP")).isEqualTo(Protocol.OTHER);
        assertThat(Protocol.fromName("IPv6-ICMP")).isEqualTo(Protocol.OTHER);
        assertThat(Protocol.fromName("")).isEqualTo(Protocol.OTHER);
        assertThat(Protocol.fromName(null)).isEqualTo(Protocol.OTHER);
        assertThat(Protocol.OTHER.code()).isZero();
    }
}
