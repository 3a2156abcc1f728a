package com.finanalytix.backend.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.finanalytix.backend.classification.rules.CategoryPatterns;
import com.finanalytix.backend.services.bankstatements.detection.BankAliases;

import lombok.extern.slf4j.Slf4j;

/**
 * Read-only lookup tables for the import pipeline, built once at startup.
 */
@Configuration
@Slf4j
public class ImportConfiguration {

    @Bean
    public BankAliases bankAliases() {
        BankAliases aliases = BankAliases.mexicanBanks();
        log.info("[Import] Bank alias table loaded: {} banks", aliases.asMap().size());
        return aliases;
    }

    @Bean
    public CategoryPatterns categoryPatterns() {
        CategoryPatterns patterns = CategoryPatterns.mexicanSmeDefaults();
        log.info("[Import] Category patterns loaded: {}", patterns.asMap().keySet());
        return patterns;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
