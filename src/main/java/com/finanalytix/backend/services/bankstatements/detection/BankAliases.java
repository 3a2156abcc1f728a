package com.finanalytix.backend.services.bankstatements.detection;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ordered bank name -> aliases table (keywords and interbank numeric codes).
 * Aliases must be lowercase. Iteration order is declaration order.
 */
public final class BankAliases {

    private final Map<String, List<String>> aliasesByBank;

    private BankAliases(Map<String, List<String>> aliasesByBank) {
        this.aliasesByBank = aliasesByBank;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Banks operating in Mexico, with the aliases that identify them in statement headers.
     */
    public static BankAliases mexicanBanks() {
        return builder()
                .bank("BBVA", "bbva", "bancomer", "014")
                .bank("SANTANDER", "santander", "0140", "banco santander")
                .bank("BANORTE", "banorte", "banorte-ixe", "058")
                .bank("HSBC", "hsbc", "021")
                .bank("BANAMEX", "banamex", "citibanamex", "002")
                .bank("SCOTIABANK", "scotiabank", "044", "scotia")
                .bank("BANCOAZTECA", "banco azteca", "062")
                .bank("INBURSA", "inbursa", "036")
                .bank("INTERACCIONES", "interacciones", "060")
                .bank("BANREGIO", "banregio", "059")
                .bank("AFIRME", "afirme", "061")
                .bank("MONEX", "monex", "056")
                .bank("MULTIVA", "multiva", "049")
                .build();
    }

    public Map<String, List<String>> asMap() {
        return aliasesByBank;
    }

    public static final class Builder {

        private final Map<String, List<String>> aliasesByBank = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder bank(String bankName, String... aliases) {
            if (bankName == null || bankName.isBlank()) throw new IllegalArgumentException("bankName is required");
            if (aliases == null || aliases.length == 0) throw new IllegalArgumentException("at least one alias is required");
            List<String> normalized = Arrays.stream(aliases)
                    .map(a -> a.toLowerCase(Locale.ROOT))
                    .toList();
            aliasesByBank.put(bankName, normalized);
            return this;
        }

        public BankAliases build() {
            return new BankAliases(Collections.unmodifiableMap(new LinkedHashMap<>(aliasesByBank)));
        }
    }
}
