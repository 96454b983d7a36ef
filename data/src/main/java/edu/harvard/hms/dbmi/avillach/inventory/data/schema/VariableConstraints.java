package edu.harvard.hms.dbmi.avillach.inventory.data.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Constraints attached to a {@link VariableDefinition}. Which fields apply depends on the variable type:
 * <ul>
 *   <li>NUMERIC: {@code min}, {@code max} (inclusive), {@code integer}</li>
 *   <li>CATEGORICAL: {@code allowedValues}</li>
 *   <li>DATE: {@code earliest}, {@code latest} (inclusive, ISO-8601)</li>
 *   <li>TEXT: {@code maxLength}, {@code pattern}</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariableConstraints(
    Double min, Double max, Boolean integer, List<String> allowedValues, String earliest, String latest, Integer maxLength, String pattern
) {

    public static final VariableConstraints NONE = new VariableConstraints(null, null, null, null, null, null, null, null);

    public VariableConstraints {
        allowedValues = allowedValues == null ? null : List.copyOf(allowedValues);
    }

    public static VariableConstraints range(Double min, Double max, boolean integer) {
        return new VariableConstraints(min, max, integer ? Boolean.TRUE : null, null, null, null, null, null);
    }

    public static VariableConstraints enumeration(List<String> allowedValues) {
        return new VariableConstraints(null, null, null, allowedValues, null, null, null, null);
    }

    public boolean requiresInteger() {
        return Boolean.TRUE.equals(integer);
    }

    /**
     * Lists the reasons these constraints cannot be attached to a variable of the given type; empty when they are consistent.
     */
    public List<String> problemsFor(VariableType type) {
        List<String> problems = new ArrayList<>();
        if (type != VariableType.NUMERIC && (min != null || max != null || integer != null)) {
            problems.add("min/max/integer only apply to NUMERIC variables");
        }
        if (type != VariableType.CATEGORICAL && allowedValues != null) {
            problems.add("allowedValues only apply to CATEGORICAL variables");
        }
        if (type != VariableType.DATE && (earliest != null || latest != null)) {
            problems.add("earliest/latest only apply to DATE variables");
        }
        if (type != VariableType.TEXT && (maxLength != null || pattern != null)) {
            problems.add("maxLength/pattern only apply to TEXT variables");
        }
        if (min != null && max != null && min > max) {
            problems.add("min " + min + " is greater than max " + max);
        }
        if (allowedValues != null && allowedValues.isEmpty()) {
            problems.add("allowedValues must not be empty");
        }
        if (earliest != null || latest != null) {
            try {
                if (earliest != null && latest != null && LocalDate.parse(earliest).isAfter(LocalDate.parse(latest))) {
                    problems.add("earliest " + earliest + " is after latest " + latest);
                }
            } catch (RuntimeException e) {
                problems.add("earliest/latest must be ISO-8601 dates");
            }
        }
        if (maxLength != null && maxLength < 1) {
            problems.add("maxLength must be positive");
        }
        if (pattern != null) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                problems.add("pattern is not a valid regular expression: " + e.getDescription());
            }
        }
        return problems;
    }

    /**
     * Checks a canonical value of the given type.
     *
     * @return a description of the violated constraint, empty if the value satisfies every constraint
     */
    public Optional<String> violation(VariableType type, String canonicalValue) {
        switch (type) {
            case NUMERIC: {
                BigDecimal value = new BigDecimal(canonicalValue);
                if (min != null && value.compareTo(BigDecimal.valueOf(min)) < 0) {
                    return Optional.of(canonicalValue + " is below the minimum " + format(min));
                }
                if (max != null && value.compareTo(BigDecimal.valueOf(max)) > 0) {
                    return Optional.of(canonicalValue + " is above the maximum " + format(max));
                }
                return Optional.empty();
            }
            case CATEGORICAL:
                if (allowedValues != null && !allowedValues.contains(canonicalValue)) {
                    return Optional.of("'" + canonicalValue + "' is not one of " + allowedValues);
                }
                return Optional.empty();
            case DATE: {
                LocalDate value = LocalDate.parse(canonicalValue);
                if (earliest != null && value.isBefore(LocalDate.parse(earliest))) {
                    return Optional.of(canonicalValue + " is before " + earliest);
                }
                if (latest != null && value.isAfter(LocalDate.parse(latest))) {
                    return Optional.of(canonicalValue + " is after " + latest);
                }
                return Optional.empty();
            }
            default:
                if (maxLength != null && canonicalValue.length() > maxLength) {
                    return Optional.of("text is longer than " + maxLength + " characters");
                }
                if (pattern != null && !Pattern.matches(pattern, canonicalValue)) {
                    return Optional.of("'" + canonicalValue + "' does not match " + pattern);
                }
                return Optional.empty();
        }
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
