package com.finanalytix.backend.analytics;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportedStatement;

/**
 * Cash movement of one account over one period, grouped by suggested category.
 * Per-category values are net (credits minus charges).
 */
public record CashFlowSnapshot(
        String bankName,
        String currency,
        LocalDate periodStart,
        LocalDate periodEnd,
        BigDecimal openingBalance,
        BigDecimal closingBalance,
        BigDecimal inflows,
        BigDecimal outflows,
        Map<String, BigDecimal> netByCategory
) {
    public CashFlowSnapshot {
        netByCategory = netByCategory == null ? Map.of() : Map.copyOf(netByCategory);
    }

    public static CashFlowSnapshot from(ImportedStatement statement) {
        Map<String, BigDecimal> byCategory = new LinkedHashMap<>();
        for (BankTransaction tx : statement.getTransactions()) {
            byCategory.merge(tx.getSuggestedCategory(), tx.netAmount(), BigDecimal::add);
        }

        return new CashFlowSnapshot(
                statement.getBankName(),
                statement.getCurrency(),
                statement.getPeriodStart(),
                statement.getPeriodEnd(),
                statement.getOpeningBalance(),
                statement.getClosingBalance(),
                statement.getTotalCredits(),
                statement.getTotalCharges(),
                byCategory);
    }

    public BigDecimal netCashFlow() {
        return inflows.subtract(outflows);
    }
}
