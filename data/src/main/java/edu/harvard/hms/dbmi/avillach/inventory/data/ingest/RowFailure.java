package edu.harvard.hms.dbmi.avillach.inventory.data.ingest;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One reason a row was rejected.
 *
 * @param variable the variable or column concerned, null when the failure applies to the whole row
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RowFailure(FailureReason reason, String variable, String detail) {

    public static RowFailure of(FailureReason reason, String detail) {
        return new RowFailure(reason, null, detail);
    }
}
