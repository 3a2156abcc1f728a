package com.finanalytix.backend.services.bankstatements.adapters;

import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Component;

import com.finanalytix.backend.services.bankstatements.adapters.HeaderMapping.Field;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.parsing.DateParser;
import com.finanalytix.backend.services.bankstatements.parsing.MoneyParser;
import com.finanalytix.backend.services.bankstatements.parsing.TransactionFactory;

import lombok.RequiredArgsConstructor;

/**
 * Turns one CSV record or spreadsheet row into a transaction using a {@link HeaderMapping}.
 */
@Component
@RequiredArgsConstructor
public class TabularRowReader {

    private final TransactionFactory transactionFactory;

    /**
     * @return the transaction, or {@code null} when the row has no readable date (skipped without a diagnostic)
     */
    public BankTransaction read(HeaderMapping mapping, List<?> row) {
        if (!mapping.has(Field.DATE)) return null;

        LocalDate date = DateParser.parse(mapping.valueOf(Field.DATE, row));
        if (date == null) return null;

        String description = TransactionFactory.cellText(mapping.valueOf(Field.DESCRIPTION, row));
        String reference = TransactionFactory.cellText(mapping.valueOf(Field.REFERENCE, row));

        return transactionFactory.create(
                date,
                description,
                reference,
                MoneyParser.parse(mapping.valueOf(Field.CHARGE, row)),
                MoneyParser.parse(mapping.valueOf(Field.CREDIT, row)),
                mapping.has(Field.BALANCE) ? MoneyParser.parseOrNull(mapping.valueOf(Field.BALANCE, row)) : null);
    }
}
