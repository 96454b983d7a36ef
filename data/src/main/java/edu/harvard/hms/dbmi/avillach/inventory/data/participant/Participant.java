package edu.harvard.hms.dbmi.avillach.inventory.data.participant;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Canonical participant identity.
 *
 * @param participantId stable surrogate key
 * @param attributes identity attributes (normalized) used for candidate matching, captured when the participant was created
 */
public record Participant(int participantId, List<SourceIdentifier> sourceIdentifiers, Map<String, String> attributes, Instant createdAt) {

    public Participant {
        sourceIdentifiers = sourceIdentifiers == null ? List.of() : ImmutableList.copyOf(sourceIdentifiers);
        attributes = attributes == null ? Map.of() : ImmutableMap.copyOf(attributes);
    }

    public Participant withSourceIdentifier(SourceIdentifier sourceIdentifier) {
        if (sourceIdentifiers.contains(sourceIdentifier)) {
            return this;
        }
        return new Participant(
            participantId, ImmutableList.<SourceIdentifier>builder().addAll(sourceIdentifiers).add(sourceIdentifier).build(), attributes,
            createdAt
        );
    }
}
