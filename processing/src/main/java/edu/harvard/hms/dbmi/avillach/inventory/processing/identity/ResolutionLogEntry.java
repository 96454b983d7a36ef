package edu.harvard.hms.dbmi.avillach.inventory.processing.identity;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit record of one identity decision.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolutionLogEntry(
    Instant at, String sourceSystem, String sourceLocalKey, ResolutionMethod method, Integer participantId, double score,
    List<Integer> candidates, Map<String, String> attributes
) {

    public ResolutionLogEntry {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
