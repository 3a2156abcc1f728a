package com.finanalytix.backend.services.bankstatements.adapters;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.finanalytix.backend.services.bankstatements.util.NormalizeUtil;

/**
 * Maps tabular header names to transaction fields.
 * A header maps to a field when its normalized name contains one of the field's aliases;
 * the first such header (left to right) wins for each field.
 */
public final class HeaderMapping {

    public enum Field {
        DATE("fecha", "date"),
        DESCRIPTION("descripcion", "concepto", "description", "detalle"),
        CHARGE("cargo", "debito", "debit", "egreso", "retiro"),
        CREDIT("abono", "credito", "credit", "ingreso", "deposito"),
        BALANCE("saldo", "balance"),
        REFERENCE("referencia", "ref", "folio");

        private final List<String> aliases;

        Field(String... aliases) {
            this.aliases = List.of(aliases);
        }

        public List<String> aliases() {
            return aliases;
        }
    }

    private final Map<Field, Integer> columns;

    private HeaderMapping(Map<Field, Integer> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static HeaderMapping resolve(List<String> headers) {
        Map<Field, Integer> columns = new EnumMap<>(Field.class);
        if (headers == null) return new HeaderMapping(columns);

        for (Field field : Field.values()) {
            Integer index = findColumn(headers, field.aliases());
            if (index != null) {
                columns.put(field, index);
            }
        }
        return new HeaderMapping(columns);
    }

    private static Integer findColumn(List<String> headers, List<String> aliases) {
        for (int i = 0; i < headers.size(); i++) {
            String header = NormalizeUtil.normalize(headers.get(i));
            if (header.isEmpty()) continue;
            for (String alias : aliases) {
                if (header.contains(alias)) {
                    return i;
                }
            }
        }
        return null;
    }

    public boolean has(Field field) {
        return columns.containsKey(field);
    }

    /**
     * Value of the field in the row, or {@code null} when the column is unmapped or the row is short.
     */
    public Object valueOf(Field field, List<?> row) {
        Integer index = columns.get(field);
        if (index == null || row == null || index >= row.size()) return null;
        return row.get(index);
    }

    public Map<Field, Integer> columns() {
        return columns;
    }
}
