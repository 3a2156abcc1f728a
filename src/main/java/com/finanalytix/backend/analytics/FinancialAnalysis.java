package com.finanalytix.backend.analytics;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record FinancialAnalysis(
        Map<String, BigDecimal> ratios,
        BigDecimal projectedTax,
        List<String> scenarios
) {
    public FinancialAnalysis {
        ratios = ratios == null ? Map.of() : Map.copyOf(ratios);
        projectedTax = projectedTax == null ? BigDecimal.ZERO : projectedTax;
        scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
    }
}
