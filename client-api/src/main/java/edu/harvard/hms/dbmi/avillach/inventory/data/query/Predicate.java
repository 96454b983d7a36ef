package edu.harvard.hms.dbmi.avillach.inventory.data.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A single condition on the current value of one variable. Which operands are used depends on the operator: {@code value} for
 * EQUALS, {@code min}/{@code max} for RANGE, {@code values} for IN and none for HAS_VALUE and MISSING. Operands are given as text and
 * read according to the variable's type (numbers, ISO-8601 dates, category codes).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Predicate(String variable, PredicateOperator operator, String value, List<String> values, String min, String max)
    implements CohortClause {

    public static Predicate equalTo(String variable, String value) {
        return new Predicate(variable, PredicateOperator.EQUALS, value, null, null, null);
    }

    public static Predicate between(String variable, String min, String max) {
        return new Predicate(variable, PredicateOperator.RANGE, null, null, min, max);
    }

    public static Predicate in(String variable, List<String> values) {
        return new Predicate(variable, PredicateOperator.IN, null, values, null, null);
    }

    public static Predicate hasValue(String variable) {
        return new Predicate(variable, PredicateOperator.HAS_VALUE, null, null, null, null);
    }

    public static Predicate missing(String variable) {
        return new Predicate(variable, PredicateOperator.MISSING, null, null, null, null);
    }

    /**
     * Human readable form used to cite this predicate in explanations, e.g. {@code age >= 30}.
     */
    public String describe() {
        if (operator == null) {
            return variable + " ?";
        }
        return switch (operator) {
            case EQUALS -> variable + " = " + value;
            case RANGE -> {
                if (min != null && max != null) {
                    yield variable + " between " + min + " and " + max;
                }
                yield min != null ? variable + " >= " + min : variable + " <= " + max;
            }
            case IN -> variable + " in " + values;
            case HAS_VALUE -> variable + " has value";
            case MISSING -> variable + " is missing";
        };
    }
}
