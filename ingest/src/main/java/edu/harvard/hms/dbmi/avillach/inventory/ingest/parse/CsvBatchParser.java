package edu.harvard.hms.dbmi.avillach.inventory.ingest.parse;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * CSV uploads: the first record is the header, every following non-empty record is a data row. A UTF-8 byte order mark is ignored.
 */
@Component
public class CsvBatchParser implements BatchParser {
    private static final Logger log = LoggerFactory.getLogger(CsvBatchParser.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setIgnoreEmptyLines(true).setQuote('"').build();

    @Override
    public UploadFormat format() {
        return UploadFormat.CSV;
    }

    @Override
    public ParsedBatch parse(byte[] content, String sheetName, int headerRow) {
        try (
            Reader reader = new InputStreamReader(
                BOMInputStream.builder().setInputStream(new ByteArrayInputStream(content)).get(), StandardCharsets.UTF_8
            );
            CSVParser parser = new CSVParser(reader, FORMAT)
        ) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                return ParsedBatch.unreadable("file is empty: no header row");
            }
            List<String> header = records.next().toList();
            List<ParsedRow> rows = new ArrayList<>();
            int rowNumber = 0;
            while (true) {
                CSVRecord record;
                try {
                    if (!records.hasNext()) {
                        break;
                    }
                    record = records.next();
                } catch (UncheckedIOException | IllegalStateException e) {
                    // the parser cannot delimit anything after this point
                    rowNumber++;
                    log.warn("CSV structure broken at data row {}: {}", rowNumber, e.getMessage());
                    rows.add(ParsedRow.malformed(rowNumber, "unparseable CSV structure, remaining content skipped: " + e.getMessage()));
                    break;
                }
                rowNumber++;
                if (record.size() != header.size()) {
                    rows.add(ParsedRow.malformed(rowNumber, "expected " + header.size() + " fields, found " + record.size()));
                } else {
                    rows.add(ParsedRow.of(rowNumber, record.toList()));
                }
            }
            log.debug("Parsed CSV upload: {} columns, {} rows", header.size(), rows.size());
            return new ParsedBatch(header, rows, null);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Unreadable CSV upload: {}", e.getMessage());
            return ParsedBatch.unreadable("unreadable CSV: " + e.getMessage());
        }
    }
}
