package com.finanalytix.backend.services.bankstatements.parsing;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class AccountNumberExtractor {

    private static final List<Pattern> ACCOUNT_PATTERNS = List.of(
            Pattern.compile("(?i)cuenta[:\\s]+(\\d{10,20})"),
            Pattern.compile("(?i)no\\.?\\s*cuenta[:\\s]+(\\d{10,20})"),
            Pattern.compile("(?i)account[:\\s]+(\\d{10,20})"),
            // masked: ****1234
            Pattern.compile("\\*{4,}(\\d{4})"));

    private AccountNumberExtractor() {
    }

    /**
     * Account number printed in the statement header, or "" when none is found.
     */
    public static String extract(String text) {
        if (text == null || text.isBlank()) return "";

        for (Pattern p : ACCOUNT_PATTERNS) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                return m.group(1);
            }
        }
        return "";
    }
}
