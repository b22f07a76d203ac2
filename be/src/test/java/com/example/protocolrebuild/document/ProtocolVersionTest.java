package com.example.protocolrebuild.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ProtocolVersion")
class ProtocolVersionTest {

    @Test
    @DisplayName("parses with or without a leading v")
    void parses() {
        assertEquals(new ProtocolVersion(2, 10, 3), ProtocolVersion.parse("2.10.3"));
        assertEquals(new ProtocolVersion(2, 10, 3), ProtocolVersion.parse(" v2.10.3 "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1.2", "1.2.3.4", "a.b.c", "1.2.-3"})
    @DisplayName("rejects anything but three numeric parts")
    void rejects(String value) {
        assertThrows(DocumentFormatException.class, () -> ProtocolVersion.parse(value));
    }

    @Test
    @DisplayName("orders numerically per component")
    void ordering() {
        ProtocolVersion v = ProtocolVersion.parse("1.9.0");

        assertTrue(ProtocolVersion.parse("1.10.0").isAfter(v));
        assertTrue(v.nextPatch().isAfter(v));
        assertTrue(v.nextMinor().isAfter(v.nextPatch()));
        assertThat(v.nextMajor()).isEqualTo(new ProtocolVersion(2, 0, 0));
        assertEquals("1.9.1", v.nextPatch().toString());
    }
}
