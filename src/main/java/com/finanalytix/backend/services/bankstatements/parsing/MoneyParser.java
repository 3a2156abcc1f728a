package com.finanalytix.backend.services.bankstatements.parsing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

import com.finanalytix.backend.services.bankstatements.util.NormalizeUtil;

/**
 * Best-effort conversion of amounts found in statements ("$1,234.56", "(500.00)", 1234.5).
 * Never throws: one malformed field must not abort a whole import.
 */
public final class MoneyParser {

    // Plain decimals only: exponent forms like "1E999999999" would overflow later arithmetic.
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[-+]?(?:\\d+(?:\\.\\d+)?|\\.\\d+)");

    private MoneyParser() {
    }

    /**
     * Returns the amount, or zero when the value is missing or cannot be read.
     */
    public static BigDecimal parse(Object value) {
        BigDecimal parsed = parseOrNull(value);
        return parsed == null ? BigDecimal.ZERO : parsed;
    }

    /**
     * Same rules as {@link #parse(Object)} but keeps "absent" apart from zero,
     * which matters for reported running balances.
     */
    public static BigDecimal parseOrNull(Object value) {
        if (value == null) return null;

        if (value instanceof BigDecimal decimal) return decimal;
        if (value instanceof BigInteger integer) return new BigDecimal(integer);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            // valueOf goes through Double.toString, so 0.1 stays 0.1
            return BigDecimal.valueOf(d);
        }

        return parseText(value.toString());
    }

    private static BigDecimal parseText(String raw) {
        String t = NormalizeUtil.normalizePdfLine(raw).trim();
        if (t.isEmpty()) return null;

        t = t.replace("$", "").replace(",", "").trim();

        // Accounting notation: (1,200.50) is a negative amount.
        if (t.contains("(") && t.contains(")")) {
            t = "-" + t.replace("(", "").replace(")", "").trim();
        }

        // Trailing minus, e.g. "943.49-"
        if (t.endsWith("-") && !t.startsWith("-") && t.length() > 1) {
            t = "-" + t.substring(0, t.length() - 1).trim();
        }

        if (!PLAIN_DECIMAL.matcher(t).matches()) return null;

        try {
            return new BigDecimal(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
