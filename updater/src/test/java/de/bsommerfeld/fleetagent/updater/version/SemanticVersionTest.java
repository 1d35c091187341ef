package de.bsommerfeld.fleetagent.updater.version;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SemanticVersionTest {

    private static SemanticVersion v(String raw) {
        return SemanticVersion.parse(raw).orElseThrow();
    }

    @Test
    void parse_shouldReadPlainAndPrefixedVersions() {
        assertEquals(new SemanticVersion(1, 2, 3, null), v("1.2.3"));
        assertEquals(new SemanticVersion(1, 2, 3, null), v("v1.2.3"));
        assertEquals(new SemanticVersion(2, 0, 0, "rc.1"), v(" 2.0.0-rc.1 "));
    }

    @Test
    void parse_shouldDropBuildMetadata() {
        assertEquals(v("1.2.3"), v("1.2.3+20240101.abc"));
    }

    @Test
    void parse_shouldFoldFourthSegmentIntoPreRelease() {
        assertEquals(new SemanticVersion(1, 2, 3, "4"), v("1.2.3.4"));
        assertEquals(new SemanticVersion(1, 2, 3, "4.beta"), v("1.2.3.4-beta"));
    }

    @Test
    void parse_shouldRejectGarbage() {
        assertTrue(SemanticVersion.parse("dev").isEmpty());
        assertTrue(SemanticVersion.parse("1.2").isEmpty());
        assertTrue(SemanticVersion.parse("").isEmpty());
        assertTrue(SemanticVersion.parse(null).isEmpty());
    }

    @Test
    void compareTo_shouldOrderByNumericComponents() {
        assertTrue(v("1.10.0").isNewerThan(v("1.9.9")));
        assertTrue(v("2.0.0").isNewerThan(v("1.99.99")));
        assertEquals(0, v("1.2.3").compareTo(v("v1.2.3")));
    }

    @Test
    void compareTo_shouldRankReleaseAbovePreRelease() {
        assertTrue(v("1.0.0").isNewerThan(v("1.0.0-rc.1")));
        assertTrue(v("1.0.0-rc.2").isNewerThan(v("1.0.0-rc.1")));
        assertTrue(v("1.0.0-beta").isNewerThan(v("1.0.0-alpha")));
        // Numeric identifiers rank below alphanumeric ones
        assertTrue(v("1.0.0-alpha").isNewerThan(v("1.0.0-1")));
        assertTrue(v("1.0.0-alpha.1").isNewerThan(v("1.0.0-alpha")));
    }

    @Test
    void toString_shouldRenderNormalizedForm() {
        assertEquals("1.2.3", v("v1.2.3+build").toString());
        assertEquals("1.2.3-rc.1", v("1.2.3-rc.1").toString());
    }
}
