package com.finanalytix.backend.services.bankstatements.model;

import java.math.BigDecimal;

public record CategoryTotals(
        int count,
        BigDecimal totalCharges,
        BigDecimal totalCredits,
        BigDecimal netAmount
) {
    public static CategoryTotals empty() {
        return new CategoryTotals(0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public CategoryTotals add(BankTransaction tx) {
        return new CategoryTotals(
                count + 1,
                totalCharges.add(tx.getChargeAmount()),
                totalCredits.add(tx.getCreditAmount()),
                netAmount.add(tx.netAmount()));
    }
}
