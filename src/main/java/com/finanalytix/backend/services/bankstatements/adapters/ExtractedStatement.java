package com.finanalytix.backend.services.bankstatements.adapters;

import java.util.List;

import com.finanalytix.backend.services.bankstatements.model.BankTransaction;

/**
 * What a format adapter read from one file, before balances and totals are resolved.
 */
public record ExtractedStatement(
        String bankName,
        String accountNumber,
        List<BankTransaction> transactions,
        String rawText
) {
    public ExtractedStatement {
        accountNumber = accountNumber == null ? "" : accountNumber;
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        rawText = rawText == null ? "" : rawText;
    }
}
