package com.finanalytix.backend.services.bankstatements.parsers;

import java.util.List;

import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportDiagnostics;

/**
 * Turns lines of PDF statement text into transactions for one bank layout.
 */
public interface BankStatementLineParser {

    boolean isApplicable(String bankName);

    List<BankTransaction> parse(List<String> lines, ImportDiagnostics diagnostics);
}
