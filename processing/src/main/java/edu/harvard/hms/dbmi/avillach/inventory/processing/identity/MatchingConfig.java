package edu.harvard.hms.dbmi.avillach.inventory.processing.identity;

import java.util.List;
import java.util.stream.Stream;

/**
 * Parameters of candidate matching.
 *
 * @param blockingKeys attributes that must be equal (after normalization) for a participant to be a candidate
 * @param similarityAttributes attributes whose Jaro-Winkler similarity is averaged into the candidate score
 * @param threshold minimum score, in [0, 1], for a candidate to be considered the same person
 */
public record MatchingConfig(List<String> blockingKeys, List<String> similarityAttributes, double threshold) {

    public static final MatchingConfig DEFAULT = new MatchingConfig(List.of("date_of_birth"), List.of("name"), 0.92);

    public MatchingConfig {
        blockingKeys = blockingKeys == null ? List.of() : List.copyOf(blockingKeys);
        similarityAttributes = similarityAttributes == null ? List.of() : List.copyOf(similarityAttributes);
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("Matching threshold must be between 0 and 1, got " + threshold);
        }
    }

    /**
     * Attribute names that take part in matching. Columns with these names carry identity, not variables.
     */
    public List<String> identityAttributes() {
        return Stream.concat(blockingKeys.stream(), similarityAttributes.stream()).distinct().toList();
    }
}
