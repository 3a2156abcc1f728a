package com.finanalytix.backend.services.bankstatements;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.finanalytix.backend.services.bankstatements.adapters.ExtractedStatement;
import com.finanalytix.backend.services.bankstatements.adapters.StatementFormatAdapter;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.CategoryTotals;
import com.finanalytix.backend.services.bankstatements.model.ImportDiagnostics;
import com.finanalytix.backend.services.bankstatements.model.ImportResult;
import com.finanalytix.backend.services.bankstatements.model.ImportedStatement;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for bank statement import (PDF, CSV, Excel).
 *
 * <p>Each call owns its diagnostics, so one instance serves concurrent imports.
 * Row-level problems come back in {@link ImportResult#diagnostics()}; only an unusable file
 * raises {@link StatementImportException}.
 */
@Service
@Slf4j
public class BankStatementImportService {

    private final Map<StatementFileType, StatementFormatAdapter> adapters;
    private final StatementBuilder statementBuilder;
    private final ImportCapabilities importCapabilities;

    public BankStatementImportService(
            List<StatementFormatAdapter> adapters,
            StatementBuilder statementBuilder,
            ImportCapabilities importCapabilities) {
        Map<StatementFileType, StatementFormatAdapter> byType = new EnumMap<>(StatementFileType.class);
        for (StatementFormatAdapter adapter : adapters) {
            StatementFormatAdapter previous = byType.putIfAbsent(adapter.fileType(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Más de un adaptador para " + adapter.fileType());
            }
        }
        this.adapters = Collections.unmodifiableMap(byType);
        this.statementBuilder = statementBuilder;
        this.importCapabilities = importCapabilities;
    }

    /**
     * Imports a statement whose type is inferred from the file name.
     */
    public ImportResult importStatement(byte[] fileBytes, String filename) {
        return importStatement(fileBytes, StatementFileType.fromFilename(filename).name(), filename);
    }

    /**
     * Imports one statement file.
     *
     * @param fileBytes    raw file content
     * @param declaredType "pdf", "csv" or "excel" ("xlsx"/"xls" accepted)
     * @param filename     original file name, used only as a hint and in logs
     * @throws UnsupportedStatementFormatException       when the declared type is not supported
     * @throws ImportInfrastructureUnavailableException  when the format cannot be read in this runtime
     * @throws StatementImportException                  when the file cannot be decoded or processed
     */
    public ImportResult importStatement(byte[] fileBytes, String declaredType, String filename) {
        StatementFileType type = StatementFileType.fromDeclaredType(declaredType);
        importCapabilities.requireSupport(type);

        StatementFormatAdapter adapter = adapters.get(type);
        if (adapter == null) {
            throw new ImportInfrastructureUnavailableException("No hay adaptador configurado para " + type);
        }

        byte[] bytes = fileBytes == null ? new byte[0] : fileBytes;
        log.info("[BankStatementImport] start type={} file='{}' bytes={}", type, filename, bytes.length);

        ImportDiagnostics diagnostics = new ImportDiagnostics();
        ImportedStatement statement;
        try {
            ExtractedStatement extracted = adapter.extract(bytes, filename, diagnostics);
            statement = statementBuilder.build(
                    extracted.bankName(),
                    extracted.accountNumber(),
                    extracted.transactions(),
                    extracted.rawText());
        } catch (StatementImportException e) {
            log.warn("[BankStatementImport] failed stage={} file='{}': {}", e.getStage(), filename, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[BankStatementImport] unexpected failure file='{}'", filename, e);
            throw new StatementImportException(StatementImportException.Stage.PROCESSING,
                    "Error procesando archivo: " + e.getMessage(), e);
        }

        logSummary(statement, diagnostics);

        return new ImportResult(statement, diagnostics.getErrors());
    }

    /**
     * Groups the statement's movements by suggested category, in first-seen order.
     */
    public Map<String, CategoryTotals> summarizeByCategory(ImportedStatement statement) {
        Map<String, CategoryTotals> summary = new LinkedHashMap<>();
        if (statement == null) return summary;

        for (BankTransaction tx : statement.getTransactions()) {
            String category = tx.getSuggestedCategory();
            summary.put(category, summary.getOrDefault(category, CategoryTotals.empty()).add(tx));
        }
        return summary;
    }

    private void logSummary(ImportedStatement statement, ImportDiagnostics diagnostics) {
        List<BankTransaction> txs = statement.getTransactions();
        long charges = txs.stream().filter(t -> t.movementType() == BankTransaction.MovementType.CHARGE).count();
        long credits = txs.stream().filter(t -> t.movementType() == BankTransaction.MovementType.CREDIT).count();
        long neutral = txs.size() - charges - credits;

        log.info("[BankStatementImport] bank={} account={} period={}..{} opening={} closing={} verified={}",
                statement.getBankName(), statement.getAccountNumber(), statement.getPeriodStart(), statement.getPeriodEnd(),
                statement.getOpeningBalance(), statement.getClosingBalance(), statement.isBalanceVerified());
        log.info("[BankStatementImport] breakdown: CHARGE={}, CREDIT={}, NEUTRAL={}, diagnostics={}",
                charges, credits, neutral, diagnostics.size());
        if (log.isDebugEnabled() && !txs.isEmpty()) {
            log.debug("[BankStatementImport] samples={}",
                    txs.stream()
                            .limit(5)
                            .map(t -> t.getDate() + " | " + t.movementType() + " | " + t.netAmount() + " | bal=" + t.getBalanceAfter() + " | " + t.getDescription())
                            .toList());
        }
    }
}
