package com.finanalytix.backend.classification;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.finanalytix.backend.classification.rules.CategoryPatterns;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionClassifier {

    private static final Locale LOCALE_ES_MX = Locale.forLanguageTag("es-MX");

    // RFC: 3 letters (persona moral) or 4 (persona física), birth/incorporation date, homoclave.
    private static final Pattern RFC_PATTERN = Pattern.compile(
            "(?<![A-Z0-9&Ñ])[A-Z&Ñ]{3,4}[0-9]{6}[A-Z0-9]{2,3}(?![A-Z0-9&Ñ])");

    private final CategoryPatterns categoryPatterns;

    /**
     * Suggests a category for the description. The first category (in table order)
     * with a matching pattern wins; {@value CategoryPatterns#OTHER} when nothing matches.
     */
    public String classify(String description) {
        if (description == null || description.isBlank()) return CategoryPatterns.OTHER;

        String lower = description.toLowerCase(LOCALE_ES_MX);

        for (Map.Entry<String, List<Pattern>> byCategory : categoryPatterns.asMap().entrySet()) {
            for (Pattern pattern : byCategory.getValue()) {
                if (pattern.matcher(lower).find()) {
                    log.debug("Matched pattern='{}' -> category='{}'", pattern.pattern(), byCategory.getKey());
                    return byCategory.getKey();
                }
            }
        }

        return CategoryPatterns.OTHER;
    }

    /**
     * Extracts a token shaped like a Mexican RFC (tax id). Structural check only:
     * no checksum or date validation.
     */
    public String extractTaxId(String text) {
        if (text == null || text.isBlank()) return null;

        Matcher m = RFC_PATTERN.matcher(text.toUpperCase(LOCALE_ES_MX));
        if (m.find()) {
            String rfc = m.group();
            if (rfc.length() == 12 || rfc.length() == 13) {
                return rfc;
            }
        }
        return null;
    }
}
