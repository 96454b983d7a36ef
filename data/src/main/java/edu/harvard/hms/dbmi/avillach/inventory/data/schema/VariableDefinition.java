package edu.harvard.hms.dbmi.avillach.inventory.data.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.FailureReason;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A variable of the schema contract. Definitions are immutable; retiring a variable publishes a copy with {@code retired} set so that
 * historical values stay interpretable.
 *
 * @param sourceColumn the column name used by the source file when it differs from {@code name}
 * @param nullable whether an explicitly empty cell is accepted (default true)
 * @param required whether every row must carry a value (default false)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariableDefinition(
    String name, String dataset, VariableType type, Boolean nullable, boolean required, VariableConstraints constraints,
    String sourceColumn, boolean retired, String description
) {

    public VariableDefinition {
        nullable = nullable == null ? Boolean.TRUE : nullable;
        constraints = constraints == null ? VariableConstraints.NONE : constraints;
    }

    public static VariableDefinition of(String name, String dataset, VariableType type, VariableConstraints constraints) {
        return new VariableDefinition(name, dataset, type, true, false, constraints, null, false, null);
    }

    public VariableDefinition asRequired() {
        return new VariableDefinition(name, dataset, type, false, true, constraints, sourceColumn, retired, description);
    }

    public VariableDefinition asRetired() {
        return new VariableDefinition(name, dataset, type, nullable, required, constraints, sourceColumn, true, description);
    }

    /**
     * Structural problems that prevent this definition from being published.
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (name == null || name.isBlank()) {
            problems.add("variable name must not be blank");
        }
        if (dataset == null || dataset.isBlank()) {
            problems.add("variable " + name + " must belong to a dataset");
        }
        if (type == null) {
            problems.add("variable " + name + " has no type");
        } else {
            constraints.problemsFor(type).forEach(problem -> problems.add("variable " + name + ": " + problem));
        }
        return problems;
    }

    /**
     * Reads a non-empty raw cell as a value of this variable.
     */
    public ValueCheck check(String raw) {
        String canonical;
        try {
            canonical = type.canonicalize(raw);
        } catch (IllegalArgumentException e) {
            return ValueCheck.failed(FailureReason.TYPE_MISMATCH, e.getMessage() + " (" + type + ")");
        }
        if (type == VariableType.NUMERIC && constraints.requiresInteger() && new BigDecimal(canonical).scale() > 0) {
            return ValueCheck.failed(FailureReason.TYPE_MISMATCH, "'" + raw.trim() + "' is not an integer");
        }
        Optional<String> violation = constraints.violation(type, canonical);
        return violation.map(detail -> ValueCheck.failed(FailureReason.CONSTRAINT_VIOLATION, detail))
            .orElseGet(() -> ValueCheck.passed(canonical));
    }

    /**
     * Result of {@link #check(String)}: either the canonical value or the failure reason and detail.
     */
    public record ValueCheck(String canonicalValue, FailureReason failureReason, String detail) {

        static ValueCheck passed(String canonicalValue) {
            return new ValueCheck(canonicalValue, null, null);
        }

        static ValueCheck failed(FailureReason failureReason, String detail) {
            return new ValueCheck(null, failureReason, detail);
        }

        public boolean isValid() {
            return failureReason == null;
        }
    }
}
