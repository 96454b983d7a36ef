package edu.harvard.hms.dbmi.avillach.inventory.util;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detects string representations of missing data in uploaded cells.
 *
 * <p>Null sentinels are treated as absent values rather than legitimate ones, so a numeric variable never fails type validation
 * because a spreadsheet exported "NA" or "None" for an empty cell.</p>
 *
 * <p>Default sentinels:</p>
 * <ul>
 *   <li>"" (empty string)</li>
 *   <li>"nan" (pandas NaN string)</li>
 *   <li>"na", "n/a" (R-style or human-readable)</li>
 *   <li>"null" (JSON null string)</li>
 *   <li>"none" (Python None string)</li>
 *   <li>"\\N" (MySQL null marker)</li>
 * </ul>
 *
 * <p>Matching is case-insensitive and whitespace is trimmed before comparison.</p>
 */
public class NullSentinelDetector {

    private static final Set<String> DEFAULT_NULL_SENTINELS = Set.of(
        "",
        "nan",
        "na",
        "n/a",
        "null",
        "none",
        "\\n"         // "\\N" after lowercasing
    );

    private final Set<String> nullSentinels;

    public NullSentinelDetector() {
        this.nullSentinels = DEFAULT_NULL_SENTINELS;
    }

    /**
     * @param customSentinels sentinel tokens, normalized (trimmed and lowercased) here; null or empty falls back to the defaults
     */
    public NullSentinelDetector(Set<String> customSentinels) {
        this.nullSentinels = customSentinels == null || customSentinels.isEmpty() ? DEFAULT_NULL_SENTINELS
            : customSentinels.stream().map(NullSentinelDetector::normalize).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @return true if the cell is null or matches one of the configured sentinels
     */
    public boolean isNullSentinel(String value) {
        if (value == null) {
            return true;
        }
        return nullSentinels.contains(normalize(value));
    }

    public Set<String> getNullSentinels() {
        return Set.copyOf(nullSentinels);
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ENGLISH);
    }
}
