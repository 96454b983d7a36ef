package edu.harvard.hms.dbmi.avillach.inventory.data.ingest;

public enum BatchOutcome {
    ACCEPTED,
    PARTIALLY_ACCEPTED,
    REJECTED;

    public static BatchOutcome of(int acceptedRows, int failedRows) {
        if (acceptedRows == 0) {
            return REJECTED;
        }
        return failedRows == 0 ? ACCEPTED : PARTIALLY_ACCEPTED;
    }
}
