package com.plm.common.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SemanticVersionTest {

    @ParameterizedTest
    @ValueSource(strings = { "1.0.0", "v2.10.3", "0.0.1-alpha", "1.2.3-rc.1+build.7", "10.20.30+meta" })
    void acceptsWellFormedVersions(String raw) {
        assertTrue(SemanticVersion.isValid(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "  ", "1", "1.0", "latest", "1.0.0.0", "1.0.x", "1.0.0-", "99999999999.0.0" })
    void rejectsMalformedVersions(String raw) {
        assertFalse(SemanticVersion.isValid(raw));
    }

    @Test
    void parsesComponents() {
        SemanticVersion.Version v = SemanticVersion.parse("v1.2.3-beta.2+sha.abc");

        assertEquals(1, v.major());
        assertEquals(2, v.minor());
        assertEquals(3, v.patch());
        assertEquals("beta.2", v.preRelease());
        assertEquals("sha.abc", v.build());
        assertEquals("1.2.3-beta.2+sha.abc", v.toString());
    }

    @Test
    void comparesVersions() {
        assertEquals(-1, SemanticVersion.compare("1.0.0", "1.0.1"));
        assertEquals(1, SemanticVersion.compare("2.0.0", "1.9.9"));
        assertEquals(0, SemanticVersion.compare("v1.0.0", "1.0.0+build"));
        assertEquals(-1, SemanticVersion.compare("1.0.0-rc.1", "1.0.0"));
        assertNull(SemanticVersion.compare("1.0.0", "nope"));
    }
}
