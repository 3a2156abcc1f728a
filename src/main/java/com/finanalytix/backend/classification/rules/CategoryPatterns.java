package com.finanalytix.backend.classification.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Ordered category -> regex patterns table used to suggest a category for a bank movement.
 * Patterns are matched against the lowercase description; declaration order is precedence.
 */
public final class CategoryPatterns {

    public static final String INTERNAL_TRANSFERS = "transferencias_internas";
    public static final String SUPPLIERS = "proveedores";
    public static final String PAYROLL = "nominas";
    public static final String TAXES = "impuestos";
    public static final String SERVICES = "servicios";
    public static final String CUSTOMERS = "clientes";
    public static final String FINANCING = "financiamiento";
    public static final String OTHER = "other";

    public record CategoryPattern(String category, Pattern pattern) {
        public CategoryPattern {
            if (category == null || category.isBlank()) throw new IllegalArgumentException("category is required");
            if (pattern == null) throw new IllegalArgumentException("pattern is required");
        }
    }

    private final Map<String, List<Pattern>> patternsByCategory;

    private CategoryPatterns(List<CategoryPattern> items) {
        Map<String, List<Pattern>> byCategory = new LinkedHashMap<>();
        for (CategoryPattern item : items) {
            byCategory.computeIfAbsent(item.category(), k -> new ArrayList<>()).add(item.pattern());
        }
        Map<String, List<Pattern>> immutable = new LinkedHashMap<>();
        for (Map.Entry<String, List<Pattern>> e : byCategory.entrySet()) {
            immutable.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.patternsByCategory = Collections.unmodifiableMap(immutable);
    }

    public static CategoryPatterns of(List<CategoryPattern> items) {
        return new CategoryPatterns(items == null ? List.of() : items);
    }

    /**
     * Categories for Mexican SME bank movements.
     */
    public static CategoryPatterns mexicanSmeDefaults() {
        List<CategoryPattern> items = new ArrayList<>();

        add(items, INTERNAL_TRANSFERS,
                "transferencia.*misma empresa",
                "traspaso.*cuenta",
                "spei.*propia",
                "transferencia entre cuentas");

        add(items, SUPPLIERS,
                "pago.*proveedor",
                "factura",
                "pago a [\\w\\s]+",
                "transferencia.*proveedor");

        add(items, PAYROLL,
                "n[oó]mina",
                "pago.*sueldo",
                "salario",
                "transferencia.*empleado",
                "spei.*nomin");

        // "sat" and "iva" match as bare substrings, so "privada" lands here too.
        add(items, TAXES,
                "sat",
                "impuesto",
                "iva",
                "isr",
                "pago provisional",
                "declaraci[oó]n");

        add(items, SERVICES,
                "luz",
                "agua",
                "tel[eé]fono",
                "internet",
                "comisi[oó]n bancaria",
                "cuota",
                "mantenimiento");

        add(items, CUSTOMERS,
                "pago.*cliente",
                "deposito.*cliente",
                "transferencia.*cliente",
                "venta",
                "cobro");

        add(items, FINANCING,
                "pago.*cr[eé]dito",
                "amortizaci[oó]n",
                "intereses",
                "comisi[oó]n.*apertura");

        return of(items);
    }

    private static void add(List<CategoryPattern> items, String category, String... regexes) {
        for (String regex : regexes) {
            items.add(new CategoryPattern(category, Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS)));
        }
    }

    public Map<String, List<Pattern>> asMap() {
        return patternsByCategory;
    }
}
