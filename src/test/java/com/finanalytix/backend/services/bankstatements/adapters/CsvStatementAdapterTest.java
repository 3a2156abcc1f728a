package com.finanalytix.backend.services.bankstatements.adapters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.finanalytix.backend.classification.TransactionClassifier;
import com.finanalytix.backend.classification.rules.CategoryPatterns;
import com.finanalytix.backend.config.ImportProperties;
import com.finanalytix.backend.services.bankstatements.StatementImportException;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportDiagnostics;
import com.finanalytix.backend.services.bankstatements.parsing.TransactionFactory;

@DisplayName("CsvStatementAdapter - archivos CSV")
class CsvStatementAdapterTest {

    private CsvStatementAdapter adapter;
    private ImportDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        TransactionFactory factory = new TransactionFactory(new TransactionClassifier(CategoryPatterns.mexicanSmeDefaults()));
        adapter = new CsvStatementAdapter(new TabularRowReader(factory), new ImportProperties());
        diagnostics = new ImportDiagnostics();
    }

    @Test
    void readsSemicolonSeparatedFileWithBalancesAndReferences() {
        String csv = String.join("\n",
                "Fecha;Concepto;Referencia;Retiros;Depósitos;Saldo",
                "01/03/2024;Pago proveedor ABC;F-100;1,500.00;;8,500.00",
                "05/03/2024;Deposito cliente;;;3,000.00;11,500.00");

        ExtractedStatement extracted = adapter.extract(utf8(csv), "movs.csv", diagnostics);

        assertEquals(CsvStatementAdapter.BANK_NAME, extracted.bankName());
        assertEquals("", extracted.accountNumber());
        assertEquals(2, extracted.transactions().size());

        BankTransaction first = extracted.transactions().get(0);
        assertEquals(LocalDate.of(2024, 3, 1), first.getDate());
        assertEquals("F-100", first.getReference());
        assertThat(first.getChargeAmount()).isEqualByComparingTo("1500.00");
        assertThat(first.getCreditAmount()).isEqualByComparingTo("0");
        assertThat(first.getBalanceAfter()).isEqualByComparingTo("8500.00");

        BankTransaction second = extracted.transactions().get(1);
        assertThat(second.getCreditAmount()).isEqualByComparingTo("3000.00");
        assertEquals(CategoryPatterns.CUSTOMERS, second.getSuggestedCategory());
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void toleratesByteOrderMark() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF});
        out.write(utf8("fecha,descripcion,cargo,abono\n01/03/2024,Pago proveedor ABC,1500.00,0\n"));

        ExtractedStatement extracted = adapter.extract(out.toByteArray(), "bom.csv", diagnostics);

        assertEquals(1, extracted.transactions().size());
    }

    @Test
    void rowsWithoutReadableDateAreSkippedSilently() {
        String csv = String.join("\n",
                "fecha,descripcion,cargo,abono",
                "sin fecha,Pago proveedor ABC,1500.00,0",
                ",Otro,1,0",
                "05/03/2024,Deposito cliente,0,3000.00");

        ExtractedStatement extracted = adapter.extract(utf8(csv), "movs.csv", diagnostics);

        assertEquals(1, extracted.transactions().size());
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void descriptionColumnIsOptional() {
        ExtractedStatement extracted = adapter.extract(utf8("fecha,cargo\n01/03/2024,10.00\n"), "movs.csv", diagnostics);

        assertEquals(1, extracted.transactions().size());
        assertEquals("", extracted.transactions().get(0).getDescription());
    }

    @Test
    void withoutDateColumnNothingIsRead() {
        ExtractedStatement extracted = adapter.extract(utf8("descripcion,cargo\nPago,10.00\n"), "movs.csv", diagnostics);

        assertThat(extracted.transactions()).isEmpty();
    }

    @Test
    void brokenQuotingKeepsRowsReadSoFar() {
        String csv = String.join("\n",
                "fecha,descripcion,cargo,abono",
                "01/03/2024,Pago proveedor ABC,1500.00,0",
                "05/03/2024,\"sin cierre,0,3000.00");

        ExtractedStatement extracted = adapter.extract(utf8(csv), "movs.csv", diagnostics);

        assertEquals(1, extracted.transactions().size());
        assertEquals(1, diagnostics.size());
        assertThat(diagnostics.getErrors().get(0)).startsWith("Error leyendo CSV");
    }

    @Test
    void rowFailuresBecomeDiagnostics() {
        TabularRowReader failing = mock(TabularRowReader.class);
        when(failing.read(any(), anyList())).thenThrow(new IllegalStateException("boom"));
        CsvStatementAdapter failingAdapter = new CsvStatementAdapter(failing, new ImportProperties());

        ExtractedStatement extracted = failingAdapter.extract(
                utf8("fecha,descripcion\n01/03/2024,a\n02/03/2024,b\n"), "movs.csv", diagnostics);

        assertThat(extracted.transactions()).isEmpty();
        assertEquals(2, diagnostics.size());
        assertThat(diagnostics.getErrors()).allSatisfy(e -> assertThat(e).startsWith("Error parseando fila").endsWith("boom"));
    }

    @Test
    void invalidUtf8IsFatal() {
        byte[] latin1 = "fecha,descripción\n".getBytes(StandardCharsets.ISO_8859_1);

        StatementImportException ex = assertThrows(StatementImportException.class,
                () -> adapter.extract(latin1, "latin1.csv", diagnostics));

        assertEquals(StatementImportException.Stage.DECODING, ex.getStage());
    }

    @Test
    void detectsDelimiter() {
        assertEquals(';', CsvStatementAdapter.detectDelimiter("a;b;c\n1;2;3", 1000));
        assertEquals('\t', CsvStatementAdapter.detectDelimiter("a\tb\tc", 1000));
        assertEquals('|', CsvStatementAdapter.detectDelimiter("a|b|c", 1000));
        assertEquals(',', CsvStatementAdapter.detectDelimiter("fecha", 1000));
        assertEquals(',', CsvStatementAdapter.detectDelimiter("", 1000));
        // only the sample is inspected
        assertEquals(',', CsvStatementAdapter.detectDelimiter("a,b;;;;", 3));
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
