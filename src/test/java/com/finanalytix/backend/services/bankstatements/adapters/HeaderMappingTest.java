package com.finanalytix.backend.services.bankstatements.adapters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.finanalytix.backend.services.bankstatements.adapters.HeaderMapping.Field;

class HeaderMappingTest {

    @Test
    void mapsSpanishHeadersIgnoringAccents() {
        HeaderMapping mapping = HeaderMapping.resolve(
                List.of("Fecha Operación", "Descripción", "Retiros", "Depósitos", "Saldo", "Referencia"));

        assertEquals(0, mapping.columns().get(Field.DATE));
        assertEquals(1, mapping.columns().get(Field.DESCRIPTION));
        assertEquals(2, mapping.columns().get(Field.CHARGE));
        assertEquals(3, mapping.columns().get(Field.CREDIT));
        assertEquals(4, mapping.columns().get(Field.BALANCE));
        assertEquals(5, mapping.columns().get(Field.REFERENCE));
    }

    @Test
    void firstMatchingHeaderWins() {
        HeaderMapping mapping = HeaderMapping.resolve(List.of("Fecha", "Fecha valor", "Concepto", "Cargo", "Abono"));

        assertEquals(0, mapping.columns().get(Field.DATE));
    }

    @Test
    void unmappedFieldsReadAsNull() {
        HeaderMapping mapping = HeaderMapping.resolve(List.of("date", "description", "debit", "credit"));

        assertFalse(mapping.has(Field.BALANCE));
        assertTrue(mapping.has(Field.CREDIT));
        assertNull(mapping.valueOf(Field.BALANCE, List.of("01/03/2024", "x", "1", "2")));
        assertNull(mapping.valueOf(Field.CREDIT, List.of("01/03/2024")));
        assertEquals("2", mapping.valueOf(Field.CREDIT, List.of("01/03/2024", "x", "1", "2")));
    }
}
