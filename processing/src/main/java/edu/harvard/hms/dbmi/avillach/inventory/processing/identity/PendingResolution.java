package edu.harvard.hms.dbmi.avillach.inventory.processing.identity;

import edu.harvard.hms.dbmi.avillach.inventory.data.participant.SourceIdentifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A source identifier whose last resolution was ambiguous and that has not been resolved since.
 */
public record PendingResolution(SourceIdentifier sourceIdentifier, Map<String, String> attributes, List<Integer> candidates, Instant flaggedAt) {
}
