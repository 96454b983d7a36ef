package edu.harvard.hms.dbmi.avillach.inventory.ingest.parse;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;

/**
 * Reads uploaded bytes into a header and text rows. Parsers never fail on a single bad row; they report it as a malformed
 * {@link ParsedRow} and continue where the format allows.
 */
public interface BatchParser {

    UploadFormat format();

    /**
     * @param sheetName worksheet to read, ignored by formats without sheets; null for the first sheet
     * @param headerRow 0-based index of the header row, ignored by formats that always start with the header
     */
    ParsedBatch parse(byte[] content, String sheetName, int headerRow);
}
