package edu.harvard.hms.dbmi.avillach.inventory.data.query;

/**
 * What the upload interface reports back to the submitter. The full per-row report is available under {@code reportReference}.
 */
public record UploadSummary(
    String batchId, String outcome, int accepted, int rejected, int ambiguous, boolean cancelled, String reportReference
) {
}
