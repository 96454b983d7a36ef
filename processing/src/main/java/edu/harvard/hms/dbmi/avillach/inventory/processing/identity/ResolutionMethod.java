package edu.harvard.hms.dbmi.avillach.inventory.processing.identity;

public enum ResolutionMethod {
    /** The source identifier was already mapped. */
    EXACT,
    /** Attached to the single candidate at or above the threshold. */
    MATCHED,
    /** No candidate; a new participant was created. */
    CREATED,
    /** Candidates exist but none or several reach the threshold; nothing was created or attached. */
    AMBIGUOUS,
    /** Decided by an operator. */
    OVERRIDE
}
