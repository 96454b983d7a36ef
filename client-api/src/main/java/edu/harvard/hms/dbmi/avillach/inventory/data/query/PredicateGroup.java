package edu.harvard.hms.dbmi.avillach.inventory.data.query;

import java.util.List;

/**
 * Clauses combined with one {@link Combinator}. Groups nest to express explicit grouping, e.g. {@code a AND (b OR c)}.
 */
public record PredicateGroup(Combinator combinator, List<CohortClause> clauses) implements CohortClause {

    public PredicateGroup {
        clauses = clauses == null ? List.of() : List.copyOf(clauses);
    }

    public static PredicateGroup and(CohortClause... clauses) {
        return new PredicateGroup(Combinator.AND, List.of(clauses));
    }

    public static PredicateGroup or(CohortClause... clauses) {
        return new PredicateGroup(Combinator.OR, List.of(clauses));
    }
}
