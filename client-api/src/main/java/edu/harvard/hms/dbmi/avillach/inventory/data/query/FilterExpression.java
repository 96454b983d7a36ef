package edu.harvard.hms.dbmi.avillach.inventory.data.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Flat filter form accepted on the wire: {@code {predicates: [...], combinator: AND|OR, groups: [...]}}. The predicates and the nested
 * groups of one expression are joined by its combinator, AND when none is given.
 */
public record FilterExpression(List<Predicate> predicates, Combinator combinator, List<FilterExpression> groups) {

    public FilterExpression {
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public PredicateGroup toClause() {
        List<CohortClause> clauses = new ArrayList<>(predicates);
        groups.forEach(group -> clauses.add(group.toClause()));
        return new PredicateGroup(combinator == null ? Combinator.AND : combinator, clauses);
    }
}
