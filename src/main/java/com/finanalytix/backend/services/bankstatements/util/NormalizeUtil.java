package com.finanalytix.backend.services.bankstatements.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public class NormalizeUtil {

    private static final Locale LOCALE_ES_MX = Locale.forLanguageTag("es-MX");

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    // \p{Z} covers NBSP and the other separators PDF and spreadsheet exports leave behind.
    private static final Pattern BLANKS = Pattern.compile("[\\s\\p{Z}]+");

    /**
     * Header/label key for alias matching: lowercase, accents removed, blanks collapsed.
     * Ejemplo: "Depósitos  (MXN)" => "depositos (mxn)"
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) return "";

        String decomposed = Normalizer.normalize(text.toLowerCase(LOCALE_ES_MX), Normalizer.Form.NFD);
        String unaccented = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return BLANKS.matcher(unaccented).replaceAll(" ").trim();
    }

    /**
     * Replaces unicode minus/dash variants and NBSP that show up in extracted PDF text.
     */
    public static String normalizePdfLine(String line) {
        if (line == null) return "";
        return line.replace('\u00A0', ' ')
                .replace('−', '-')
                .replace('–', '-')
                .replace('—', '-');
    }
}
