package edu.harvard.hms.dbmi.avillach.inventory.util;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NullSentinelDetectorTest {

    @Test
    void testDefaultNullSentinels() {
        NullSentinelDetector detector = new NullSentinelDetector();

        assertTrue(detector.isNullSentinel(null), "null should be null sentinel");
        assertTrue(detector.isNullSentinel(""), "Empty string should be null sentinel");
        assertTrue(detector.isNullSentinel("NaN"), "NaN should be null sentinel");
        assertTrue(detector.isNullSentinel("NA"), "NA should be null sentinel");
        assertTrue(detector.isNullSentinel("n/a"), "n/a should be null sentinel");
        assertTrue(detector.isNullSentinel("NULL"), "NULL should be null sentinel");
        assertTrue(detector.isNullSentinel("None"), "None should be null sentinel");
        assertTrue(detector.isNullSentinel("\\N"), "MySQL null marker should be null sentinel");
    }

    @Test
    void testWhitespaceHandling() {
        NullSentinelDetector detector = new NullSentinelDetector();

        assertTrue(detector.isNullSentinel("  nan  "), "nan with surrounding spaces should be detected");
        assertTrue(detector.isNullSentinel("\tNone\t"), "None with tabs should be detected");
        assertTrue(detector.isNullSentinel(" "), "Space should be detected as empty");
    }

    @Test
    void testNonSentinels() {
        NullSentinelDetector detector = new NullSentinelDetector();

        assertFalse(detector.isNullSentinel("0"), "Zero should not be null sentinel");
        assertFalse(detector.isNullSentinel("34"), "Numeric string should not be null sentinel");
        assertFalse(detector.isNullSentinel("Not Applicable"), "Full phrase should not be null sentinel");
        assertFalse(detector.isNullSentinel("A"), "Category code should not be null sentinel");
    }

    @Test
    void testCustomSentinelsAreNormalized() {
        NullSentinelDetector detector = new NullSentinelDetector(Set.of("  MISSING ", "-999"));

        assertTrue(detector.isNullSentinel("missing"));
        assertTrue(detector.isNullSentinel("-999"));
        assertFalse(detector.isNullSentinel("NA"), "Custom sentinels replace the defaults");
        assertEquals(Set.of("missing", "-999"), detector.getNullSentinels());
    }

    @Test
    void testEmptyCustomSetFallsBackToDefaults() {
        NullSentinelDetector detector = new NullSentinelDetector(Set.of());

        assertTrue(detector.isNullSentinel("none"));
    }
}
