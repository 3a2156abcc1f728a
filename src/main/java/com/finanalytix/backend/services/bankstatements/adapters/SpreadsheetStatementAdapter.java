package com.finanalytix.backend.services.bankstatements.adapters;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import com.finanalytix.backend.services.bankstatements.StatementFileType;
import com.finanalytix.backend.services.bankstatements.StatementImportException;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportDiagnostics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads .xlsx and .xls statements: first sheet, first row as headers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpreadsheetStatementAdapter implements StatementFormatAdapter {

    public static final String BANK_NAME = "EXCEL";

    private final TabularRowReader tabularRowReader;

    @Override
    public StatementFileType fileType() {
        return StatementFileType.EXCEL;
    }

    @Override
    public ExtractedStatement extract(byte[] bytes, String filename, ImportDiagnostics diagnostics) {
        List<BankTransaction> transactions = new ArrayList<>();

        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(bytes == null ? new byte[0] : bytes))) {
            if (workbook.getNumberOfSheets() == 0) {
                return new ExtractedStatement(BANK_NAME, "", List.of(), "");
            }

            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return new ExtractedStatement(BANK_NAME, "", List.of(), "");
            }

            List<String> headers = new ArrayList<>();
            for (Object value : readCells(headerRow)) {
                headers.add(value == null ? "" : value.toString());
            }
            HeaderMapping mapping = HeaderMapping.resolve(headers);

            log.info("[SpreadsheetAdapter] file='{}' sheet='{}' rows={} mapping={}",
                    filename, sheet.getSheetName(), sheet.getLastRowNum(), mapping.columns());

            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                try {
                    List<Object> cells = readCells(row);
                    if (isBlank(cells)) continue;

                    BankTransaction tx = tabularRowReader.read(mapping, cells);
                    if (tx != null) {
                        transactions.add(tx);
                    }
                } catch (RuntimeException e) {
                    diagnostics.add("Error en fila " + (r + 1) + ": " + e.getMessage());
                }
            }
        } catch (EncryptedDocumentException e) {
            throw new StatementImportException(StatementImportException.Stage.DECODING,
                    "Archivo Excel protegido por contraseña", e);
        } catch (IOException | RuntimeException e) {
            throw new StatementImportException(StatementImportException.Stage.DECODING,
                    "No se pudo abrir el archivo Excel: " + e.getMessage(), e);
        }

        log.info("[SpreadsheetAdapter] parsed {} transactions, {} diagnostics", transactions.size(), diagnostics.size());
        return new ExtractedStatement(BANK_NAME, "", transactions, "");
    }

    private static List<Object> readCells(Row row) {
        if (row == null || row.getLastCellNum() < 0) return List.of();

        List<Object> values = new ArrayList<>(row.getLastCellNum());
        for (int c = 0; c < row.getLastCellNum(); c++) {
            values.add(cellValue(row.getCell(c)));
        }
        return values;
    }

    private static Object cellValue(Cell cell) {
        if (cell == null) return null;

        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }

        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue()
                    : BigDecimal.valueOf(cell.getNumericCellValue());
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }

    private static boolean isBlank(List<Object> cells) {
        for (Object value : cells) {
            if (value == null) continue;
            if (value instanceof String s && s.isBlank()) continue;
            return false;
        }
        return true;
    }
}
