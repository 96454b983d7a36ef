package edu.harvard.hms.dbmi.avillach.inventory.data.ingest;

/**
 * Stable enumeration of row-level rejection reasons recorded in a {@link ValidationReport}.
 */
public enum FailureReason {
    MALFORMED_ROW("Row structure could not be parsed"),
    UNKNOWN_VARIABLE("Column is not an active variable of the schema version"),
    MISSING_REQUIRED("Required value missing or empty"),
    TYPE_MISMATCH("Value cannot be read as the variable's type"),
    CONSTRAINT_VIOLATION("Value outside the variable's range or enumeration"),
    IDENTITY_AMBIGUOUS("Participant identity could not be resolved unambiguously");

    private final String description;

    FailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
