package com.finanalytix.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Settings for bank statement import.
 * Loaded from application.properties with prefix "finanalytix.import".
 *
 * Example:
 * finanalytix.import.default-currency=MXN
 * finanalytix.import.pdf.enabled=true
 * finanalytix.import.csv.delimiter-sample-size=1000
 */
@Data
@Validated
@ConfigurationProperties(prefix = "finanalytix.import")
public class ImportProperties {

    /**
     * Currency stamped on every imported statement.
     */
    @NotBlank
    private String defaultCurrency = "MXN";

    /**
     * Max length of descriptions produced by the generic PDF line parser.
     */
    @Min(10)
    private int genericDescriptionMaxLength = 100;

    @Valid
    private Toggle pdf = new Toggle();

    @Valid
    private Toggle spreadsheet = new Toggle();

    @Valid
    private Csv csv = new Csv();

    @Valid
    private Debug debug = new Debug();

    @Data
    public static class Toggle {

        /**
         * When false the format is reported as unavailable, as if its library were missing.
         */
        private boolean enabled = true;
    }

    @Data
    public static class Csv {

        /**
         * Number of leading characters inspected to pick the field delimiter.
         */
        @Min(1)
        private int delimiterSampleSize = 1000;
    }

    @Data
    public static class Debug {

        private boolean logExtractedText = false;

        @Min(0)
        private int extractedTextMaxChars = 500;
    }
}
