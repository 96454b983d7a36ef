package edu.harvard.hms.dbmi.avillach.inventory.data.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Validation outcome of a single uploaded row.
 *
 * @param rowNumber 1-based data row number, the header excluded
 * @param participantId canonical participant the row was merged into, null for rejected rows
 * @param valuesMerged number of variable values appended to the store for this row
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RowResult(int rowNumber, String sourceLocalKey, Integer participantId, List<RowFailure> failures, int valuesMerged) {

    public RowResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static RowResult accepted(int rowNumber, String sourceLocalKey, int participantId, int valuesMerged) {
        return new RowResult(rowNumber, sourceLocalKey, participantId, List.of(), valuesMerged);
    }

    public static RowResult rejected(int rowNumber, String sourceLocalKey, List<RowFailure> failures) {
        return new RowResult(rowNumber, sourceLocalKey, null, failures, 0);
    }

    @JsonIgnore
    public boolean isAccepted() {
        return failures.isEmpty();
    }

    @JsonIgnore
    public boolean isAmbiguous() {
        return failures.stream().anyMatch(failure -> failure.reason() == FailureReason.IDENTITY_AMBIGUOUS);
    }
}
