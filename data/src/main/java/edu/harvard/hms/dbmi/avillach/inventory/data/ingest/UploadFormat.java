package edu.harvard.hms.dbmi.avillach.inventory.data.ingest;

import java.util.Locale;

public enum UploadFormat {
    CSV,
    XLSX;

    /**
     * Resolves a format from a name or file extension such as "csv" or "visit.xlsx".
     */
    public static UploadFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Upload format must be csv or xlsx");
        }
        String lowerCase = name.trim().toLowerCase(Locale.ENGLISH);
        int dot = lowerCase.lastIndexOf('.');
        String extension = dot >= 0 ? lowerCase.substring(dot + 1) : lowerCase;
        return switch (extension) {
            case "csv" -> CSV;
            case "xlsx" -> XLSX;
            default -> throw new IllegalArgumentException("Unsupported upload format '" + name + "' (expected csv or xlsx)");
        };
    }
}
