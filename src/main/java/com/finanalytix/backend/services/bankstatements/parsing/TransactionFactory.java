package com.finanalytix.backend.services.bankstatements.parsing;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.springframework.stereotype.Component;

import com.finanalytix.backend.classification.TransactionClassifier;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;

import lombok.RequiredArgsConstructor;

/**
 * Builds classified {@link BankTransaction}s from values read by the format adapters.
 */
@Component
@RequiredArgsConstructor
public class TransactionFactory {

    private final TransactionClassifier transactionClassifier;

    public BankTransaction create(
            LocalDate date,
            String description,
            String reference,
            BigDecimal charge,
            BigDecimal credit,
            BigDecimal balanceAfter) {
        String desc = description == null ? "" : description;

        return BankTransaction.builder()
                .date(date)
                .description(desc)
                .reference(reference == null ? "" : reference.trim())
                .chargeAmount(nonNegative(charge))
                .creditAmount(nonNegative(credit))
                .balanceAfter(balanceAfter)
                .cleanedDescription(desc.trim())
                .suggestedCategory(transactionClassifier.classify(desc))
                .detectedTaxId(transactionClassifier.extractTaxId(desc))
                .build();
    }

    /**
     * Renders a cell value as text; numeric cells lose the ".0" spreadsheets add to whole numbers.
     */
    public static String cellText(Object value) {
        if (value == null) return "";
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    // Charge/credit columns sometimes carry a sign ("-1,500.00" in the cargo column).
    private static BigDecimal nonNegative(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO : amount.abs();
    }
}
