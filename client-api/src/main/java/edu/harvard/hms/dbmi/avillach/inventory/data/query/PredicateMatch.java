package edu.harvard.hms.dbmi.avillach.inventory.data.query;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Why one participant satisfied one predicate: the predicate and the current value that drove the match. For MISSING predicates no
 * value exists and only the predicate is cited.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PredicateMatch(String predicate, String variable, Long valueId, String value, String batchId) {
}
