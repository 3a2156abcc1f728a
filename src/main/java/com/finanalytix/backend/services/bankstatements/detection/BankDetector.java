package com.finanalytix.backend.services.bankstatements.detection;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Identifies the issuing bank from statement text by alias substring match.
 * The first bank in table order with any matching alias wins; there is no scoring.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BankDetector {

    public static final String UNKNOWN = "UNKNOWN";

    private final BankAliases bankAliases;

    public String detect(String documentText) {
        if (documentText == null || documentText.isBlank()) return UNKNOWN;

        String lower = documentText.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> entry : bankAliases.asMap().entrySet()) {
            for (String alias : entry.getValue()) {
                if (lower.contains(alias)) {
                    log.debug("[BankDetector] alias='{}' -> bank={}", alias, entry.getKey());
                    return entry.getKey();
                }
            }
        }

        return UNKNOWN;
    }
}
