package com.finanalytix.backend.services.bankstatements.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One bank account over one period, built once per import and never mutated.
 */
@Getter
@ToString(exclude = "transactions")
public final class ImportedStatement {

    private static final BigDecimal BALANCE_TOLERANCE = new BigDecimal("0.01");

    private final String bankName;
    private final String accountNumber;
    private final String currency;
    private final LocalDate periodStart;
    private final LocalDate periodEnd;
    private final BigDecimal openingBalance;
    private final BigDecimal closingBalance;
    private final List<BankTransaction> transactions;
    private final BigDecimal totalCharges;
    private final BigDecimal totalCredits;

    @Builder
    public ImportedStatement(
            String bankName,
            String accountNumber,
            String currency,
            LocalDate periodStart,
            LocalDate periodEnd,
            BigDecimal openingBalance,
            BigDecimal closingBalance,
            List<BankTransaction> transactions,
            BigDecimal totalCharges,
            BigDecimal totalCredits) {
        this.bankName = bankName;
        this.accountNumber = accountNumber == null ? "" : accountNumber;
        this.currency = currency == null || currency.isBlank() ? "MXN" : currency;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.openingBalance = nz(openingBalance);
        this.closingBalance = nz(closingBalance);
        this.transactions = transactions == null ? List.of() : List.copyOf(transactions);
        this.totalCharges = nz(totalCharges);
        this.totalCredits = nz(totalCredits);
    }

    /**
     * True when opening + credits - charges lands within one cent of the closing balance.
     * A statement that fails this check is still a valid import result, just flagged.
     */
    public boolean isBalanceVerified() {
        BigDecimal computed = openingBalance.add(totalCredits).subtract(totalCharges);
        return computed.subtract(closingBalance).abs().compareTo(BALANCE_TOLERANCE) < 0;
    }

    public BigDecimal netMovement() {
        return totalCredits.subtract(totalCharges);
    }

    /**
     * Leading transactions for paginated consumers; the statement itself keeps all of them.
     */
    public List<BankTransaction> previewTransactions(int limit) {
        if (limit <= 0) return List.of();
        return transactions.size() <= limit ? transactions : transactions.subList(0, limit);
    }

    private static BigDecimal nz(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }
}
