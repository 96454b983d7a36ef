package edu.harvard.hms.dbmi.avillach.inventory.data.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Result of a cohort query.
 *
 * @param participants matched participant ids in ascending order, null when the query did not ask for them
 * @param explanation one entry per matched participant, in ascending participant order
 * @param predicateCounts number of participants matched by each evaluated predicate, keyed by {@link Predicate#describe()}
 * @param snapshot store watermark the query was evaluated against
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CohortResult(
    UUID queryId, int count, List<Integer> participants, List<ParticipantExplanation> explanation, Map<String, Integer> predicateCounts,
    long snapshot
) {
}
