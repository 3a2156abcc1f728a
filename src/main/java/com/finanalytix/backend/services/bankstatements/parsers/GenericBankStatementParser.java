package com.finanalytix.backend.services.bankstatements.parsers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.finanalytix.backend.config.ImportProperties;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportDiagnostics;
import com.finanalytix.backend.services.bankstatements.parsing.DateParser;
import com.finanalytix.backend.services.bankstatements.parsing.MoneyParser;
import com.finanalytix.backend.services.bankstatements.parsing.TransactionFactory;
import com.finanalytix.backend.services.bankstatements.util.NormalizeUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback for banks without a dedicated layout: any line with a date followed by an amount.
 *
 * <p>Whether the amount is a charge or a credit is guessed from the words "cargo" and "abono"
 * in the rest of the line. This is imprecise: a line mentioning neither yields a zero movement,
 * and a line mentioning both fills both sides.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenericBankStatementParser implements BankStatementLineParser {

    private static final Pattern DATE_THEN_AMOUNT = Pattern.compile(
            "(?<![\\d/-])(\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4})(?!\\d)"
                    + ".*?"
                    + "(?<![\\d,.])(\\d{1,3}(?:,\\d{3})+\\.\\d{2}|\\d+\\.\\d{2})(?!\\d)");

    private final TransactionFactory transactionFactory;
    private final ImportProperties importProperties;

    @Override
    public boolean isApplicable(String bankName) {
        return true;
    }

    @Override
    public List<BankTransaction> parse(List<String> lines, ImportDiagnostics diagnostics) {
        List<BankTransaction> out = new ArrayList<>();
        if (lines == null) return out;

        int lineNumber = 0;
        for (String raw : lines) {
            lineNumber++;
            String line = NormalizeUtil.normalizePdfLine(raw);

            Matcher m = DATE_THEN_AMOUNT.matcher(line);
            if (!m.find()) continue;

            LocalDate date = DateParser.parseTextToken(m.group(1));
            if (date == null) continue;

            try {
                out.add(toTransaction(line, m, date));
            } catch (RuntimeException e) {
                diagnostics.add("Error en línea " + lineNumber + ": " + e.getMessage());
            }
        }

        log.debug("[GenericParser] {} lines -> {} transactions", lines.size(), out.size());
        return out;
    }

    private BankTransaction toTransaction(String line, Matcher m, LocalDate date) {
        String fullText = surroundingText(line, m);

        // Keywords are looked up in the whole line; only the stored description is shortened.
        String lower = fullText.toLowerCase(Locale.ROOT);
        BigDecimal amount = MoneyParser.parse(m.group(2));
        BigDecimal charge = lower.contains("cargo") ? amount : BigDecimal.ZERO;
        BigDecimal credit = lower.contains("abono") ? amount : BigDecimal.ZERO;

        int maxLength = importProperties.getGenericDescriptionMaxLength();
        String description = fullText.length() > maxLength
                ? fullText.substring(0, maxLength).trim()
                : fullText;

        return transactionFactory.create(date, description, "", charge, credit, null);
    }

    // The line without its date and amount tokens.
    private static String surroundingText(String line, Matcher m) {
        String before = line.substring(0, m.start(1));
        String between = line.substring(m.end(1), m.start(2));
        String after = line.substring(m.end(2));
        return (before + " " + between + " " + after).replaceAll("\\s+", " ").trim();
    }
}
