package com.finanalytix.backend.services.bankstatements;

import java.util.Locale;

public enum StatementFileType {
    PDF,
    CSV,
    EXCEL;

    /**
     * Maps the declared type tag ("pdf", "csv", "excel", plus "xlsx"/"xls") to a file type.
     *
     * @throws UnsupportedStatementFormatException for any other tag
     */
    public static StatementFileType fromDeclaredType(String declaredType) {
        String t = declaredType == null ? "" : declaredType.trim().toLowerCase(Locale.ROOT);
        return switch (t) {
            case "pdf" -> PDF;
            case "csv" -> CSV;
            case "excel", "xlsx", "xls" -> EXCEL;
            default -> throw new UnsupportedStatementFormatException(declaredType);
        };
    }

    /**
     * Infers the type from an uploaded file name, the way the upload form does.
     *
     * @throws UnsupportedStatementFormatException when the name carries no known extension
     */
    public static StatementFileType fromFilename(String filename) {
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (name.contains("pdf")) return PDF;
        if (name.contains("csv")) return CSV;
        if (name.contains("xlsx") || name.contains("xls")) return EXCEL;
        throw new UnsupportedStatementFormatException(filename);
    }
}
