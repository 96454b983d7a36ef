package edu.harvard.hms.dbmi.avillach.inventory.ingest.parse;

import java.util.List;

/**
 * One data row as text cells, aligned with the header.
 *
 * @param rowNumber 1-based data row number, the header excluded
 * @param structuralError why the row could not be aligned with the header, null for well-formed rows
 */
public record ParsedRow(int rowNumber, List<String> cells, String structuralError) {

    public ParsedRow {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    public static ParsedRow of(int rowNumber, List<String> cells) {
        return new ParsedRow(rowNumber, cells, null);
    }

    public static ParsedRow malformed(int rowNumber, String structuralError) {
        return new ParsedRow(rowNumber, List.of(), structuralError);
    }

    public String cell(int index) {
        return index < cells.size() ? cells.get(index) : null;
    }
}
