package com.finanalytix.backend.services.bankstatements.parsers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportDiagnostics;
import com.finanalytix.backend.services.bankstatements.parsing.DateParser;
import com.finanalytix.backend.services.bankstatements.parsing.MoneyParser;
import com.finanalytix.backend.services.bankstatements.parsing.TransactionFactory;
import com.finanalytix.backend.services.bankstatements.util.NormalizeUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * BBVA México statement lines:
 * <pre>
 *   dd/MM/yyyy  DESCRIPCION ...  [cargo]  [abono]  [saldo]
 * </pre>
 * Amounts use "1,234.56". They fill cargo, abono and saldo from left to right, so a line with a
 * single amount is read as a cargo.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BbvaBankStatementParser implements BankStatementLineParser {

    public static final String BANK_NAME = "BBVA";

    private static final String AMOUNT = "-?\\d[\\d,]*\\.\\d{2}";

    private static final Pattern TX_LINE = Pattern.compile(
            "^\\s*(\\d{2}/\\d{2}/\\d{4})\\s+(.+?)\\s+(" + AMOUNT + ")(?:\\s+(" + AMOUNT + "))?(?:\\s+(" + AMOUNT + "))?\\s*$");

    private final TransactionFactory transactionFactory;

    @Override
    public boolean isApplicable(String bankName) {
        return BANK_NAME.equals(bankName);
    }

    @Override
    public List<BankTransaction> parse(List<String> lines, ImportDiagnostics diagnostics) {
        List<BankTransaction> out = new ArrayList<>();
        if (lines == null) return out;

        int lineNumber = 0;
        for (String raw : lines) {
            lineNumber++;
            String line = NormalizeUtil.normalizePdfLine(raw).trim();
            if (line.isEmpty()) continue;

            Matcher m = TX_LINE.matcher(line);
            if (!m.matches()) continue;

            try {
                BankTransaction tx = toTransaction(m);
                if (tx != null) {
                    out.add(tx);
                }
            } catch (RuntimeException e) {
                diagnostics.add("Error en línea " + lineNumber + " (BBVA): " + e.getMessage());
            }
        }

        log.debug("[BbvaParser] {} lines -> {} transactions", lines.size(), out.size());
        return out;
    }

    private BankTransaction toTransaction(Matcher m) {
        LocalDate date = DateParser.parse(m.group(1));
        if (date == null) return null;

        String description = cleanupDescription(m.group(2));
        // SALDO ANTERIOR / SALDO FINAL rows carry balances, not movements.
        if (isBalanceLine(description)) return null;

        BigDecimal charge = MoneyParser.parse(m.group(3));
        BigDecimal credit = MoneyParser.parse(m.group(4));
        BigDecimal balance = MoneyParser.parseOrNull(m.group(5));

        return transactionFactory.create(date, description, "", charge, credit, balance);
    }

    static boolean isBalanceLine(String description) {
        if (description == null) return false;
        String desc = description.toUpperCase(Locale.ROOT).trim();
        return desc.startsWith("SALDO ");
    }

    private static String cleanupDescription(String raw) {
        if (raw == null) return "";
        return raw.replaceAll("\\s+", " ").trim();
    }
}
