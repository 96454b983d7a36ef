package edu.harvard.hms.dbmi.avillach.inventory.data.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;

/**
 * A source dataset of the contract and how its files are laid out.
 *
 * @param sheetName worksheet to read for XLSX sources, the first sheet when null
 * @param headerRow 0-based index of the header row for XLSX sources
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DatasetDefinition(String name, String description, UploadFormat kind, String fileName, String sheetName, Integer headerRow) {

    public DatasetDefinition {
        headerRow = headerRow == null ? 0 : headerRow;
    }

    public static DatasetDefinition named(String name) {
        return new DatasetDefinition(name, null, null, null, null, 0);
    }
}
