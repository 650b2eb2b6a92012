package io.osquerymcp.core.version;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

class VersionRangeTest {

    @Test
    @DisplayName("describe renders each bound combination")
    void describe() {
        assertEquals("1.0.0 to 2.0.0", VersionRange.between("1.0.0", "2.0.0").describe());
        assertEquals("2.12.0 or later", VersionRange.atLeast("2.12.0").describe());
        assertEquals("up to 1.3.0", VersionRange.atMost("1.3.0").describe());
        assertNull(VersionRange.unbounded().describe());
    }

    @Test
    @DisplayName("blank bounds are treated as absent")
    void blankBounds() {
        VersionRange range = new VersionRange(" ", "");
        assertTrue(range.isUnbounded());
        assertNull(range.min());
    }

    @Test
    @DisplayName("inverted bounds are rejected")
    void invertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> VersionRange.between("2.0.0", "1.0.0"));
    }

    @Test
    @DisplayName("malformed bounds are rejected at construction")
    void malformedBound() {
        assertThrows(VersionParseException.class, () -> VersionRange.atLeast("one"));
    }

    @Test
    @DisplayName("contains delegates to inclusive comparison")
    void contains() {
        VersionRange range = VersionRange.between("1.0.0", "2.0.0");
        assertTrue(range.contains("1.5"));
        assertFalse(range.contains("0.9.9"));
    }
}
