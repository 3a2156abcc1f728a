package com.finanalytix.backend.services.bankstatements.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.finanalytix.backend.classification.rules.CategoryPatterns;

import lombok.Builder;
import lombok.Value;

/**
 * One bank movement as read from a statement line or row.
 * Charge and credit are both non-negative; both being zero is a legal, non-movement line.
 */
@Value
@Builder(toBuilder = true)
public class BankTransaction {

    public enum MovementType {
        CHARGE,
        CREDIT,
        NEUTRAL
    }

    LocalDate date;

    @Builder.Default
    String description = "";

    @Builder.Default
    String reference = "";

    @Builder.Default
    BigDecimal chargeAmount = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal creditAmount = BigDecimal.ZERO;

    /** Running balance as printed by the bank, when present. */
    BigDecimal balanceAfter;

    @Builder.Default
    String cleanedDescription = "";

    @Builder.Default
    String suggestedCategory = CategoryPatterns.OTHER;

    // Reserved: internal transfer detection is not implemented yet.
    boolean internalTransfer;

    String detectedCounterpartyName;

    String detectedTaxId;

    public BigDecimal netAmount() {
        return creditAmount.subtract(chargeAmount);
    }

    public MovementType movementType() {
        if (chargeAmount.signum() > 0) return MovementType.CHARGE;
        if (creditAmount.signum() > 0) return MovementType.CREDIT;
        return MovementType.NEUTRAL;
    }
}
