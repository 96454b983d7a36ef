package edu.harvard.hms.dbmi.avillach.inventory.data.ingest;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A closed ingestion attempt. Values in the store reference the batch by {@code batchId}; the batch itself is never changed after it
 * is closed.
 *
 * @param schemaVersion the version validated against, null when the requested version did not exist
 * @param contentHash SHA-256 over the source system and the uploaded bytes, used to detect re-submissions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadBatch(
    String batchId, String sourceSystem, String submitter, Instant submittedAt, Integer schemaVersion, String dataset,
    UploadFormat format, String contentHash, BatchOutcome outcome, boolean cancelled, ValidationReport report
) {
}
