package edu.harvard.hms.dbmi.avillach.inventory.ingest.parse;

import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XlsxBatchParserTest {

    private final XlsxBatchParser parser = new XlsxBatchParser();

    private static byte[] workbook() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            workbook.createSheet("Notes").createRow(0).createCell(0).setCellValue("exported 2024-05-01");

            Sheet sheet = workbook.createSheet("Visits");
            sheet.createRow(0).createCell(0).setCellValue("Visit export");
            Row header = sheet.createRow(2);
            header.createCell(0).setCellValue("participant_id");
            header.createCell(1).setCellValue("age");
            header.createCell(2).setCellValue("visit_date");

            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("dd/mm/yyyy"));

            Row first = sheet.createRow(3);
            first.createCell(0).setCellValue("P1");
            first.createCell(1).setCellValue(34.0);
            first.createCell(2).setCellValue(LocalDate.of(2024, 3, 1));
            first.getCell(2).setCellStyle(dateStyle);

            // row 4 left blank
            Row second = sheet.createRow(5);
            second.createCell(0).setCellValue("P2");
            second.createCell(1).setCellValue(36.5);

            Row third = sheet.createRow(6);
            third.createCell(0).setCellValue("P3");
            third.createCell(4).setCellValue("stray");

            workbook.write(out);
            return out.toByteArray();
        }
    }

    @Test
    public void parse_namedSheetWithOffsetHeader() throws IOException {
        ParsedBatch batch = parser.parse(workbook(), "Visits", 2);

        assertNull(batch.batchError());
        assertEquals(List.of("participant_id", "age", "visit_date"), batch.header());
        assertEquals(3, batch.rows().size());
        assertEquals(List.of("P1", "34", "2024-03-01"), batch.rows().get(0).cells());
        assertEquals(List.of("P2", "36.5", ""), batch.rows().get(1).cells());
        assertEquals(2, batch.rows().get(1).rowNumber(), "blank rows are not counted");
        assertNotNull(batch.rows().get(2).structuralError());
    }

    @Test
    public void parse_defaultsToFirstSheet() throws IOException {
        ParsedBatch batch = parser.parse(workbook(), null, 0);

        assertEquals(List.of("exported 2024-05-01"), batch.header());
        assertTrue(batch.rows().isEmpty());
    }

    @Test
    public void parse_missingSheetOrNotAWorkbook_isUnreadable() throws IOException {
        assertTrue(parser.parse(workbook(), "Labs", 0).batchError().contains("Labs"));
        assertNotNull(parser.parse("participant_id,age\n".getBytes(StandardCharsets.UTF_8), null, 0).batchError());
    }
}
