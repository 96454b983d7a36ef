package edu.harvard.hms.dbmi.avillach.inventory.data.query;

public enum PredicateOperator {
    /** current value equals {@code value} */
    EQUALS,
    /** current value lies within {@code min} and/or {@code max}, both inclusive; numeric and date variables only */
    RANGE,
    /** current value is one of {@code values}; categorical variables only */
    IN,
    /** participant has any current value */
    HAS_VALUE,
    /** participant has no current value */
    MISSING
}
