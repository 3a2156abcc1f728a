package com.finanalytix.backend.services.bankstatements.adapters;

import com.finanalytix.backend.services.bankstatements.StatementFileType;
import com.finanalytix.backend.services.bankstatements.model.ImportDiagnostics;

public interface StatementFormatAdapter {

    StatementFileType fileType();

    /**
     * Reads transactions from the file. Row-level problems go to {@code diagnostics};
     * only an unreadable file throws.
     *
     * @throws com.finanalytix.backend.services.bankstatements.StatementImportException when the bytes cannot be decoded
     */
    ExtractedStatement extract(byte[] bytes, String filename, ImportDiagnostics diagnostics);
}
