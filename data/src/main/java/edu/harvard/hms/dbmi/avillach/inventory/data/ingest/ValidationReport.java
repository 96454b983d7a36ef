package edu.harvard.hms.dbmi.avillach.inventory.data.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Per-row pass/fail record of an upload. {@code batchError} is set when the batch was rejected as a whole (for example an unknown
 * schema version or an unreadable file) before any row was examined.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationReport(List<RowResult> rows, String batchError) {

    public ValidationReport {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static ValidationReport batchFailure(String batchError) {
        return new ValidationReport(List.of(), batchError);
    }

    @JsonIgnore
    public int getAcceptedCount() {
        return (int) rows.stream().filter(RowResult::isAccepted).count();
    }

    @JsonIgnore
    public int getRejectedCount() {
        return rows.size() - getAcceptedCount();
    }

    @JsonIgnore
    public int getAmbiguousCount() {
        return (int) rows.stream().filter(RowResult::isAmbiguous).count();
    }

    @JsonIgnore
    public List<RowResult> getRejectedRows() {
        return rows.stream().filter(row -> !row.isAccepted()).toList();
    }
}
