package com.finanalytix.backend.services.bankstatements.parsers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.finanalytix.backend.services.bankstatements.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Splits extracted PDF text into candidate movement lines.
 */
@Slf4j
public final class StatementLineSplitter {

    // Start-of-text or whitespace before the date, so references like "D01/12" inside a description don't split.
    private static final Pattern ENTRY_DATE_TOKEN = Pattern.compile(
            "(?:(?<=^)|(?<=\\s))(\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4})\\s+");

    private static final int COLLAPSED_LINE_LIMIT = 2;

    private StatementLineSplitter() {
    }

    /**
     * Statement text as lines, with PDF separators (NBSP, unicode dashes) normalized.
     */
    public static List<String> splitLines(String rawText) {
        if (rawText == null || rawText.isBlank()) return List.of();
        return NormalizeUtil.normalizePdfLine(rawText).lines().toList();
    }

    /**
     * Lines of one bank's statement. Some PDFs come out of text extraction as one or two
     * physical lines; for those the movements are recovered by cutting before each entry date.
     */
    public static List<String> splitLinesSmart(String rawText, String bankName) {
        List<String> lines = splitLines(rawText);

        long nonBlank = lines.stream().filter(l -> !l.isBlank()).count();
        if (nonBlank > COLLAPSED_LINE_LIMIT) return lines;

        List<String> entries = splitByEntryDateTokens(rawText);
        if (entries.size() <= lines.size()) return lines;

        log.info("[LineSplitter] bank={} text collapsed into {} line(s); re-split into {} entries",
                bankName, nonBlank, entries.size());
        return entries;
    }

    static List<String> splitByEntryDateTokens(String rawText) {
        if (rawText == null || rawText.isBlank()) return List.of();

        String t = NormalizeUtil.normalizePdfLine(rawText).trim();
        if (t.isEmpty()) return List.of();

        Matcher m = ENTRY_DATE_TOKEN.matcher(t);
        List<Integer> starts = new ArrayList<>();
        while (m.find()) {
            starts.add(m.start(1));
        }

        if (starts.size() <= 1) {
            return splitLines(rawText);
        }

        List<String> out = new ArrayList<>(starts.size());
        // Header text before the first entry stays as its own line (it may hold balance labels).
        if (starts.get(0) > 0) {
            String head = t.substring(0, starts.get(0)).trim();
            if (!head.isEmpty()) out.add(head);
        }
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = (i + 1 < starts.size()) ? starts.get(i + 1) : t.length();
            String chunk = t.substring(start, end).trim();
            if (!chunk.isEmpty()) {
                out.add(chunk);
            }
        }

        return out;
    }
}
