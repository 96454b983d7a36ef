package edu.harvard.hms.dbmi.avillach.inventory.ingest.parse;

import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * XLSX uploads: one worksheet, the header on a configurable row, data rows below it. Blank rows are skipped. Numeric cells are read as
 * plain decimals and date-formatted cells as ISO-8601 dates so the values do not depend on the workbook's display formats.
 */
@Component
public class XlsxBatchParser implements BatchParser {
    private static final Logger log = LoggerFactory.getLogger(XlsxBatchParser.class);

    @Override
    public UploadFormat format() {
        return UploadFormat.XLSX;
    }

    @Override
    public ParsedBatch parse(byte[] content, String sheetName, int headerRow) {
        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(content))) {
            Sheet sheet = sheetName == null ? workbook.getSheetAt(0) : workbook.getSheet(sheetName);
            if (sheet == null) {
                return ParsedBatch.unreadable("worksheet '" + sheetName + "' not found");
            }
            Row headerCells = sheet.getRow(headerRow);
            if (headerCells == null) {
                return ParsedBatch.unreadable("no header on row " + headerRow + " of worksheet '" + sheet.getSheetName() + "'");
            }
            List<String> header = new ArrayList<>();
            for (int i = 0; i < headerCells.getLastCellNum(); i++) {
                header.add(text(headerCells.getCell(i)));
            }
            while (!header.isEmpty() && header.get(header.size() - 1).isBlank()) {
                header.remove(header.size() - 1);
            }

            List<ParsedRow> rows = new ArrayList<>();
            int rowNumber = 0;
            for (int r = headerRow + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                List<String> cells = new ArrayList<>();
                boolean blank = true;
                boolean overflow = false;
                if (row != null) {
                    for (int c = 0; c < Math.max(row.getLastCellNum(), header.size()); c++) {
                        String value = text(row.getCell(c));
                        if (!value.isBlank()) {
                            blank = false;
                            overflow |= c >= header.size();
                        }
                        if (c < header.size()) {
                            cells.add(value);
                        }
                    }
                }
                if (blank) {
                    continue;
                }
                rowNumber++;
                rows.add(
                    overflow
                        ? ParsedRow.malformed(rowNumber, "row " + (r + 1) + " has values beyond the " + header.size() + " header columns")
                        : ParsedRow.of(rowNumber, cells)
                );
            }
            log.debug("Parsed XLSX upload (sheet {}): {} columns, {} rows", sheet.getSheetName(), header.size(), rows.size());
            return new ParsedBatch(header, rows, null);
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable XLSX upload: {}", e.getMessage());
            return ParsedBatch.unreadable("unreadable XLSX: " + e.getMessage());
        }
    }

    private static String text(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                BigDecimal number = BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros();
                return number.scale() < 0 ? number.setScale(0).toPlainString() : number.toPlainString();
            case STRING:
                return cell.getStringCellValue();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }
}
