package com.finanalytix.backend.services.bankstatements;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.finanalytix.backend.config.ImportProperties;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportedStatement;

@DisplayName("StatementBuilder - orden, totales y saldos")
class StatementBuilderTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    private ImportProperties properties;
    private StatementBuilder builder;

    @BeforeEach
    void setUp() {
        properties = new ImportProperties();
        Clock clock = Clock.fixed(TODAY.atStartOfDay(ZoneId.of("America/Mexico_City")).toInstant(), ZoneId.of("America/Mexico_City"));
        builder = new StatementBuilder(properties, clock);
    }

    @Test
    void emptyInputGivesZeroStatementDatedToday() {
        ImportedStatement statement = builder.build("CSV", "", List.of(), "");

        assertTrue(statement.getTransactions().isEmpty());
        assertEquals(TODAY, statement.getPeriodStart());
        assertEquals(TODAY, statement.getPeriodEnd());
        assertThat(statement.getTotalCharges()).isEqualByComparingTo("0");
        assertThat(statement.getTotalCredits()).isEqualByComparingTo("0");
        assertThat(statement.getOpeningBalance()).isEqualByComparingTo("0");
        assertThat(statement.getClosingBalance()).isEqualByComparingTo("0");
        assertEquals("MXN", statement.getCurrency());
        assertTrue(statement.isBalanceVerified());
    }

    @Test
    void sortsByDateKeepingSameDayOrder() {
        BankTransaction late = tx(LocalDate.of(2024, 3, 5), "late", "0", "1");
        BankTransaction early = tx(LocalDate.of(2024, 3, 1), "early", "1", "0");
        BankTransaction sameDayA = tx(LocalDate.of(2024, 3, 3), "a", "2", "0");
        BankTransaction sameDayB = tx(LocalDate.of(2024, 3, 3), "b", "3", "0");

        ImportedStatement statement = builder.build("CSV", "", List.of(late, sameDayA, early, sameDayB), "");

        assertEquals(List.of(early, sameDayA, sameDayB, late), statement.getTransactions());
        assertEquals(LocalDate.of(2024, 3, 1), statement.getPeriodStart());
        assertEquals(LocalDate.of(2024, 3, 5), statement.getPeriodEnd());
    }

    @Test
    void balancesFromStatementText() {
        String text = "Saldo anterior: $1,000.00\n...\nSaldo final: 1,300.00";
        List<BankTransaction> txs = List.of(
                tx(LocalDate.of(2024, 3, 1), "pago", "200.00", "0"),
                tx(LocalDate.of(2024, 3, 2), "deposito", "0", "500.00"));

        ImportedStatement statement = builder.build("BBVA", "0123456789", txs, text);

        assertThat(statement.getOpeningBalance()).isEqualByComparingTo("1000.00");
        assertThat(statement.getClosingBalance()).isEqualByComparingTo("1300.00");
        assertThat(statement.getTotalCharges()).isEqualByComparingTo("200.00");
        assertThat(statement.getTotalCredits()).isEqualByComparingTo("500.00");
        assertTrue(statement.isBalanceVerified());
    }

    @Test
    void balancesFromRunningBalancesWhenTextHasNone() {
        List<BankTransaction> txs = List.of(
                tx(LocalDate.of(2024, 3, 1), "pago", "200.00", "0").toBuilder().balanceAfter(new BigDecimal("800.00")).build(),
                tx(LocalDate.of(2024, 3, 2), "deposito", "0", "500.00").toBuilder().balanceAfter(new BigDecimal("1300.00")).build());

        ImportedStatement statement = builder.build("CSV", "", txs, "");

        assertThat(statement.getOpeningBalance()).isEqualByComparingTo("800.00");
        assertThat(statement.getClosingBalance()).isEqualByComparingTo("1300.00");
    }

    @Test
    void closingIsInferredWithoutAnyBalance() {
        List<BankTransaction> txs = List.of(
                tx(LocalDate.of(2024, 3, 1), "pago", "200.00", "0"),
                tx(LocalDate.of(2024, 3, 2), "deposito", "0", "500.00"));

        ImportedStatement statement = builder.build("CSV", "", txs, "");

        assertThat(statement.getOpeningBalance()).isEqualByComparingTo("0");
        assertThat(statement.getClosingBalance()).isEqualByComparingTo("300.00");
        assertTrue(statement.isBalanceVerified());
    }

    @Test
    void balanceVerificationLaw() {
        ImportedStatement.ImportedStatementBuilder base = ImportedStatement.builder()
                .bankName("CSV")
                .openingBalance(new BigDecimal("1000"))
                .totalCredits(new BigDecimal("500"))
                .totalCharges(new BigDecimal("200"));

        assertTrue(base.closingBalance(new BigDecimal("1300")).build().isBalanceVerified());
        assertTrue(base.closingBalance(new BigDecimal("1300.009")).build().isBalanceVerified());
        assertFalse(base.closingBalance(new BigDecimal("1000")).build().isBalanceVerified());
        assertFalse(base.closingBalance(new BigDecimal("1300.01")).build().isBalanceVerified());
    }

    @Test
    void currencyComesFromConfiguration() {
        properties.setDefaultCurrency("USD");

        assertEquals("USD", builder.build("CSV", "", List.of(), "").getCurrency());
    }

    @Test
    void extractsLabelledBalances() {
        assertThat(StatementBuilder.extractOpeningBalance("SALDO INICIAL 5,000.00")).isEqualByComparingTo("5000.00");
        assertThat(StatementBuilder.extractOpeningBalance("Saldo al inicio: $2,500.00")).isEqualByComparingTo("2500.00");
        assertThat(StatementBuilder.extractClosingBalance("SALDO AL CORTE 1,234.56")).isEqualByComparingTo("1234.56");
        assertThat(StatementBuilder.extractClosingBalance("Saldo actual: 99.10")).isEqualByComparingTo("99.10");
        assertThat(StatementBuilder.extractClosingBalance("sin saldos")).isNull();
        assertThat(StatementBuilder.extractOpeningBalance(null)).isNull();
    }

    private static BankTransaction tx(LocalDate date, String description, String charge, String credit) {
        return BankTransaction.builder()
                .date(date)
                .description(description)
                .cleanedDescription(description)
                .chargeAmount(new BigDecimal(charge))
                .creditAmount(new BigDecimal(credit))
                .build();
    }
}
