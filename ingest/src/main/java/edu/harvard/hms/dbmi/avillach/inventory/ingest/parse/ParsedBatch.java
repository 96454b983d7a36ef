package edu.harvard.hms.dbmi.avillach.inventory.ingest.parse;

import java.util.List;

/**
 * @param batchError set when the content could not be read at all; header and rows are then empty
 */
public record ParsedBatch(List<String> header, List<ParsedRow> rows, String batchError) {

    public ParsedBatch {
        header = header == null ? List.of() : List.copyOf(header);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static ParsedBatch unreadable(String batchError) {
        return new ParsedBatch(List.of(), List.of(), batchError);
    }
}
