package edu.harvard.hms.dbmi.avillach.inventory.processing.query;

import edu.harvard.hms.dbmi.avillach.inventory.data.query.CohortClause;
import edu.harvard.hms.dbmi.avillach.inventory.data.query.Predicate;
import edu.harvard.hms.dbmi.avillach.inventory.data.query.PredicateGroup;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableType;
import edu.harvard.hms.dbmi.avillach.inventory.exception.InvalidPredicateException;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PredicateValidator {

    public void validate(CohortClause clause, SchemaVersion schema) {
        if (clause instanceof PredicateGroup group) {
            validateGroup(group, schema);
        } else if (clause instanceof Predicate predicate) {
            validate(predicate, schema);
        }
    }

    private void validateGroup(PredicateGroup group, SchemaVersion schema) {
        if (group.combinator() == null) {
            throw new InvalidPredicateException("Predicate group must declare a combinator (AND or OR)");
        } else if (group.clauses().isEmpty()) {
            throw new InvalidPredicateException("Predicate group " + group.combinator() + " has no clauses");
        }
        group.clauses().forEach(child -> validate(child, schema));
    }

    public void validate(Predicate predicate, SchemaVersion schema) {
        if (predicate.variable() == null || predicate.variable().isBlank()) {
            throw new InvalidPredicateException("Predicate must name a variable");
        } else if (predicate.operator() == null) {
            throw new InvalidPredicateException("Predicate on " + predicate.variable() + " must declare an operator");
        }
        VariableDefinition definition = schema.definition(predicate.variable()).orElseThrow(
            () -> new InvalidPredicateException(predicate.variable() + " is not a variable of schema version " + schema.version())
        );
        if (definition.retired()) {
            throw new InvalidPredicateException(predicate.variable() + " is retired in schema version " + schema.version());
        }
        switch (predicate.operator()) {
            case EQUALS -> validateEquals(predicate, definition);
            case RANGE -> validateRange(predicate, definition);
            case IN -> validateIn(predicate, definition);
            case HAS_VALUE, MISSING -> validateNoOperands(predicate);
        }
    }

    private void validateEquals(Predicate predicate, VariableDefinition definition) {
        if (predicate.value() == null) {
            throw new InvalidPredicateException(predicate.describe() + ": EQUALS requires a value");
        } else if (predicate.values() != null || predicate.min() != null || predicate.max() != null) {
            throw new InvalidPredicateException(predicate.describe() + ": EQUALS takes only a value, not values or min/max");
        }
        operand(predicate, definition, predicate.value());
    }

    private void validateRange(Predicate predicate, VariableDefinition definition) {
        if (!definition.type().isOrdered()) {
            throw new InvalidPredicateException(
                predicate.variable() + " is a " + definition.type() + " variable; RANGE applies to NUMERIC and DATE variables"
            );
        } else if (predicate.min() == null && predicate.max() == null) {
            throw new InvalidPredicateException(predicate.variable() + ": RANGE requires min, max or both");
        } else if (predicate.value() != null || predicate.values() != null) {
            throw new InvalidPredicateException(predicate.describe() + ": RANGE takes only min/max");
        }
        String min = predicate.min() == null ? null : operand(predicate, definition, predicate.min());
        String max = predicate.max() == null ? null : operand(predicate, definition, predicate.max());
        if (min != null && max != null && definition.type().compare(min, max) > 0) {
            throw new InvalidPredicateException(predicate.describe() + ": min is greater than max");
        }
    }

    private void validateIn(Predicate predicate, VariableDefinition definition) {
        if (definition.type() != VariableType.CATEGORICAL) {
            throw new InvalidPredicateException(
                predicate.variable() + " is a " + definition.type() + " variable; IN applies to CATEGORICAL variables"
            );
        } else if (predicate.values() == null || predicate.values().isEmpty()) {
            throw new InvalidPredicateException(predicate.variable() + ": IN requires at least one value");
        } else if (predicate.value() != null || predicate.min() != null || predicate.max() != null) {
            throw new InvalidPredicateException(predicate.describe() + ": IN takes only values");
        }
        predicate.values().forEach(value -> operand(predicate, definition, value));
    }

    private void validateNoOperands(Predicate predicate) {
        if (predicate.value() != null || predicate.values() != null || predicate.min() != null || predicate.max() != null) {
            throw new InvalidPredicateException(predicate.describe() + " takes no operands");
        }
    }

    /**
     * Reads an operand as a value of the variable's type and checks it against the variable's enumeration, if any.
     */
    private String operand(Predicate predicate, VariableDefinition definition, String raw) {
        if (raw == null) {
            throw new InvalidPredicateException(predicate.variable() + ": operands must not be null");
        }
        String canonical;
        try {
            canonical = definition.type().canonicalize(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidPredicateException(predicate.variable() + ": " + e.getMessage() + " (" + definition.type() + ")");
        }
        List<String> allowedValues = definition.constraints().allowedValues();
        if (allowedValues != null && !allowedValues.contains(canonical)) {
            throw new InvalidPredicateException(
                predicate.variable() + ": '" + canonical + "' is not one of the allowed values " + allowedValues
            );
        }
        return canonical;
    }
}
