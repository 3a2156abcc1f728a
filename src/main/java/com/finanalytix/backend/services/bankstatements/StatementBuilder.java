package com.finanalytix.backend.services.bankstatements;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.finanalytix.backend.config.ImportProperties;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportedStatement;
import com.finanalytix.backend.services.bankstatements.parsing.MoneyParser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Assembles parsed transactions into an {@link ImportedStatement}: chronological order,
 * totals, and opening/closing balances.
 *
 * <p>Balances come from the statement text when its labels are present ("saldo anterior",
 * "saldo al corte"...), otherwise from the running balance of the first/last movement. A missing
 * closing balance is computed as opening + credits - charges.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatementBuilder {

    private static final List<Pattern> OPENING_PATTERNS = List.of(
            Pattern.compile("(?i)saldo\\s*(?:anterior|inicial|previous)[:\\s]+\\$?([\\d,]+\\.\\d{2})"),
            Pattern.compile("(?i)saldo\\s*al\\s*inicio[:\\s]+\\$?([\\d,]+\\.\\d{2})"));

    private static final List<Pattern> CLOSING_PATTERNS = List.of(
            Pattern.compile("(?i)saldo\\s*(?:final|actual|current)[:\\s]+\\$?([\\d,]+\\.\\d{2})"),
            Pattern.compile("(?i)saldo\\s*al\\s*corte[:\\s]+\\$?([\\d,]+\\.\\d{2})"));

    private final ImportProperties importProperties;
    private final Clock clock;

    public ImportedStatement build(String bank, String account, List<BankTransaction> transactions, String rawText) {
        String currency = importProperties.getDefaultCurrency();

        if (transactions == null || transactions.isEmpty()) {
            LocalDate today = LocalDate.now(clock);
            return ImportedStatement.builder()
                    .bankName(bank)
                    .accountNumber(account)
                    .currency(currency)
                    .periodStart(today)
                    .periodEnd(today)
                    .openingBalance(BigDecimal.ZERO)
                    .closingBalance(BigDecimal.ZERO)
                    .transactions(List.of())
                    .totalCharges(BigDecimal.ZERO)
                    .totalCredits(BigDecimal.ZERO)
                    .build();
        }

        // List.sort is stable: same-day movements keep their statement order.
        List<BankTransaction> sorted = new ArrayList<>(transactions);
        sorted.sort(Comparator.comparing(BankTransaction::getDate));

        BigDecimal totalCharges = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;
        for (BankTransaction tx : sorted) {
            totalCharges = totalCharges.add(tx.getChargeAmount());
            totalCredits = totalCredits.add(tx.getCreditAmount());
        }

        BankTransaction first = sorted.get(0);
        BankTransaction last = sorted.get(sorted.size() - 1);

        BigDecimal opening = extractOpeningBalance(rawText);
        BigDecimal closing = extractClosingBalance(rawText);
        boolean openingFromText = opening != null;
        boolean closingFromText = closing != null;

        if (opening == null) {
            opening = first.getBalanceAfter() != null ? first.getBalanceAfter() : BigDecimal.ZERO;
        }
        if (closing == null) {
            closing = last.getBalanceAfter() != null
                    ? last.getBalanceAfter()
                    : opening.add(totalCredits).subtract(totalCharges);
        }

        log.debug("[StatementBuilder] opening={} (fromText={}) closing={} (fromText={})",
                opening, openingFromText, closing, closingFromText);

        return ImportedStatement.builder()
                .bankName(bank)
                .accountNumber(account)
                .currency(currency)
                .periodStart(first.getDate())
                .periodEnd(last.getDate())
                .openingBalance(opening)
                .closingBalance(closing)
                .transactions(sorted)
                .totalCharges(totalCharges)
                .totalCredits(totalCredits)
                .build();
    }

    static BigDecimal extractBalance(String text, List<Pattern> patterns) {
        if (text == null || text.isBlank()) return null;

        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                BigDecimal value = MoneyParser.parseOrNull(m.group(1));
                if (value != null) return value;
            }
        }
        return null;
    }

    static BigDecimal extractOpeningBalance(String text) {
        return extractBalance(text, OPENING_PATTERNS);
    }

    static BigDecimal extractClosingBalance(String text) {
        return extractBalance(text, CLOSING_PATTERNS);
    }
}
