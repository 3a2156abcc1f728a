package com.finanalytix.backend.services.bankstatements.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

class ImportedStatementTest {

    @Test
    void defaultsMissingValues() {
        ImportedStatement statement = ImportedStatement.builder().bankName("CSV").build();

        assertThat(statement.getCurrency()).isEqualTo("MXN");
        assertThat(statement.getAccountNumber()).isEmpty();
        assertThat(statement.getTransactions()).isEmpty();
        assertThat(statement.getOpeningBalance()).isEqualByComparingTo("0");
    }

    @Test
    void previewCapsTransactionsWithoutChangingStatement() {
        List<BankTransaction> txs = List.of(tx(1), tx(2), tx(3));
        ImportedStatement statement = ImportedStatement.builder().transactions(txs).build();

        assertThat(statement.previewTransactions(2)).containsExactly(txs.get(0), txs.get(1));
        assertThat(statement.previewTransactions(10)).hasSize(3);
        assertThat(statement.previewTransactions(0)).isEmpty();
        assertThat(statement.getTransactions()).hasSize(3);
    }

    @Test
    void netMovementIsCreditsMinusCharges() {
        ImportedStatement statement = ImportedStatement.builder()
                .totalCredits(new BigDecimal("500"))
                .totalCharges(new BigDecimal("200"))
                .build();

        assertThat(statement.netMovement()).isEqualByComparingTo("300");
    }

    @Test
    void movementTypeFollowsAmounts() {
        BankTransaction charge = BankTransaction.builder().chargeAmount(new BigDecimal("10")).build();
        BankTransaction credit = BankTransaction.builder().creditAmount(new BigDecimal("10")).build();
        BankTransaction neutral = BankTransaction.builder().build();

        assertThat(charge.movementType()).isEqualTo(BankTransaction.MovementType.CHARGE);
        assertThat(charge.netAmount()).isEqualByComparingTo("-10");
        assertThat(credit.movementType()).isEqualTo(BankTransaction.MovementType.CREDIT);
        assertThat(neutral.movementType()).isEqualTo(BankTransaction.MovementType.NEUTRAL);
        assertThat(neutral.getSuggestedCategory()).isEqualTo("other");
        assertThat(neutral.isInternalTransfer()).isFalse();
    }

    private static BankTransaction tx(int day) {
        return BankTransaction.builder().date(LocalDate.of(2024, 3, day)).description("mov " + day).build();
    }
}
