package edu.harvard.hms.dbmi.avillach.inventory.data.schema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * The fixed set of semantic variable types. Stored values are kept in a canonical text form produced by {@link #canonicalize(String)};
 * ordering and equality of canonical values are type-aware.
 */
public enum VariableType {
    CATEGORICAL,
    NUMERIC,
    DATE,
    TEXT;

    /**
     * Largest number of digits allowed on either side of the decimal point in a NUMERIC value.
     */
    public static final int MAX_NUMERIC_DIGITS = 1000;

    /**
     * @return true if range comparisons are meaningful for this type
     */
    public boolean isOrdered() {
        return this == NUMERIC || this == DATE;
    }

    /**
     * Converts raw cell text into the canonical form stored for this type.
     *
     * @throws IllegalArgumentException if the text cannot be read as this type
     */
    public String canonicalize(String raw) {
        String trimmed = raw.trim();
        switch (this) {
            case NUMERIC:
                try {
                    BigDecimal number = new BigDecimal(trimmed).stripTrailingZeros();
                    long integerDigits = (long) number.precision() - number.scale();
                    if (integerDigits > MAX_NUMERIC_DIGITS || number.scale() > MAX_NUMERIC_DIGITS) {
                        throw new IllegalArgumentException("'" + raw + "' is out of the supported numeric range");
                    }
                    return number.scale() < 0 ? number.setScale(0).toPlainString() : number.toPlainString();
                } catch (NumberFormatException | ArithmeticException e) {
                    throw new IllegalArgumentException("'" + raw + "' is not a number");
                }
            case DATE:
                try {
                    return LocalDate.parse(trimmed).toString();
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("'" + raw + "' is not an ISO-8601 date (yyyy-MM-dd)");
                }
            default:
                return trimmed;
        }
    }

    /**
     * Compares two canonical values of this type.
     */
    public int compare(String left, String right) {
        switch (this) {
            case NUMERIC:
                return new BigDecimal(left).compareTo(new BigDecimal(right));
            case DATE:
                return LocalDate.parse(left).compareTo(LocalDate.parse(right));
            default:
                return left.compareTo(right);
        }
    }

    public boolean isEqual(String left, String right) {
        return compare(left, right) == 0;
    }
}
