package edu.harvard.hms.dbmi.avillach.inventory.ingest.pipeline;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;

/**
 * An uploaded file as received.
 *
 * @param dataset dataset the file belongs to, null to match columns against every dataset of the schema version
 * @param sheetName worksheet to read for XLSX uploads, null for the dataset's configured sheet or the first one
 */
public record RawBatch(UploadFormat format, byte[] content, String dataset, String sheetName) {

    public RawBatch {
        if (format == null) {
            throw new IllegalArgumentException("Upload format is required");
        }
        if (content == null) {
            throw new IllegalArgumentException("Upload content is required");
        }
    }

    public static RawBatch of(UploadFormat format, byte[] content) {
        return new RawBatch(format, content, null, null);
    }

    public RawBatch forDataset(String dataset) {
        return new RawBatch(format, content, dataset, sheetName);
    }
}
