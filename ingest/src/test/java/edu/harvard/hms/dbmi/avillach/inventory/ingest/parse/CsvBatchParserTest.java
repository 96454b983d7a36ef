package edu.harvard.hms.dbmi.avillach.inventory.ingest.parse;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvBatchParserTest {

    private final CsvBatchParser parser = new CsvBatchParser();

    private ParsedBatch parse(String content) {
        return parser.parse(content.getBytes(StandardCharsets.UTF_8), null, 0);
    }

    @Test
    public void parse_headerAndRows() {
        ParsedBatch batch = parse("participant_id,age,comment\nP1,34,\"fine, thanks\"\n\nP2,51,\n");

        assertNull(batch.batchError());
        assertEquals(List.of("participant_id", "age", "comment"), batch.header());
        assertEquals(2, batch.rows().size());
        assertEquals(List.of("P1", "34", "fine, thanks"), batch.rows().get(0).cells());
        assertEquals(2, batch.rows().get(1).rowNumber());
        assertEquals("", batch.rows().get(1).cell(2));
    }

    @Test
    public void parse_byteOrderMarkIsIgnored() {
        ParsedBatch batch = parse("\uFEFFparticipant_id,age\nP1,34\n");

        assertEquals("participant_id", batch.header().get(0));
    }

    @Test
    public void parse_fieldCountMismatch_isMalformedRow() {
        ParsedBatch batch = parse("participant_id,age\nP1,34,extra\nP2,35\n");

        assertNotNull(batch.rows().get(0).structuralError());
        assertNull(batch.rows().get(1).structuralError());
    }

    @Test
    public void parse_brokenQuoting_reportsOneMalformedRowAndStops() {
        ParsedBatch batch = parse("participant_id,age\nP1,34\nP2,\"35\nP3,36\n");

        assertNull(batch.batchError());
        assertNull(batch.rows().get(0).structuralError());
        ParsedRow last = batch.rows().get(batch.rows().size() - 1);
        assertNotNull(last.structuralError());
    }

    @Test
    public void parse_emptyFile_isUnreadable() {
        assertNotNull(parse("").batchError());
    }
}
