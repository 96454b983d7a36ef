package edu.harvard.hms.dbmi.avillach.inventory.data.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A structured cohort filter. A null clause selects every known participant.
 *
 * On the wire the filter is given either as a {@code clause} tree or in the flat {@link FilterExpression} form, with
 * {@code predicates}, {@code combinator} and {@code groups} at the top level of the query.
 *
 * @param includeParticipants whether the result lists participant ids in addition to the count and explanation
 * @param id identifies the query while it runs so that it can be cancelled
 */
public record CohortQuery(CohortClause clause, Boolean includeParticipants, UUID id) {

    public CohortQuery(CohortClause clause) {
        this(clause, true, null);
    }

    @JsonCreator
    public static CohortQuery fromJson(
        @JsonProperty("clause") CohortClause clause, @JsonProperty("predicates") List<Predicate> predicates,
        @JsonProperty("combinator") Combinator combinator, @JsonProperty("groups") List<FilterExpression> groups,
        @JsonProperty("includeParticipants") Boolean includeParticipants, @JsonProperty("id") UUID id
    ) {
        boolean flat = predicates != null || groups != null || combinator != null;
        if (clause != null && flat) {
            throw new IllegalArgumentException("A query gives either a clause or predicates/combinator/groups, not both");
        }
        CohortClause filter = flat ? new FilterExpression(predicates, combinator, groups).toClause() : clause;
        return new CohortQuery(filter, includeParticipants, id);
    }

    public boolean wantsParticipants() {
        return includeParticipants == null || includeParticipants;
    }

    public List<Predicate> allPredicates() {
        List<Predicate> predicates = new ArrayList<>();
        flatten(clause, predicates);
        return predicates;
    }

    private void flatten(CohortClause clause, List<Predicate> predicates) {
        if (clause instanceof Predicate predicate) {
            predicates.add(predicate);
        } else if (clause instanceof PredicateGroup group) {
            group.clauses().forEach(child -> flatten(child, predicates));
        }
    }

    /**
     * @return this query, or a copy of it with a fresh id if it has none
     */
    public CohortQuery generateId() {
        if (id != null) {
            return this;
        }
        return new CohortQuery(clause, includeParticipants, UUID.randomUUID());
    }
}
