package com.finanalytix.backend.services.bankstatements.adapters;

import java.io.IOException;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Component;

import com.finanalytix.backend.config.ImportProperties;
import com.finanalytix.backend.services.bankstatements.StatementFileType;
import com.finanalytix.backend.services.bankstatements.StatementImportException;
import com.finanalytix.backend.services.bankstatements.detection.BankDetector;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportDiagnostics;
import com.finanalytix.backend.services.bankstatements.parsers.BankStatementLineParser;
import com.finanalytix.backend.services.bankstatements.parsers.GenericBankStatementParser;
import com.finanalytix.backend.services.bankstatements.parsers.StatementLineSplitter;
import com.finanalytix.backend.services.bankstatements.parsing.AccountNumberExtractor;
import com.finanalytix.backend.services.pdf.PdfTextExtractor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class PdfStatementAdapter implements StatementFormatAdapter {

    private final PdfTextExtractor pdfTextExtractor;
    private final BankDetector bankDetector;
    private final List<BankStatementLineParser> lineParsers;
    private final GenericBankStatementParser genericParser;
    private final ImportProperties importProperties;

    @Override
    public StatementFileType fileType() {
        return StatementFileType.PDF;
    }

    @Override
    public ExtractedStatement extract(byte[] bytes, String filename, ImportDiagnostics diagnostics) {
        if (bytes == null || bytes.length == 0) {
            throw new StatementImportException(StatementImportException.Stage.DECODING, "PDF vacío (0 bytes)");
        }

        String text;
        try (PDDocument document = PDDocument.load(bytes)) {
            text = safeExtractTextSorted(document);
            if (text == null || text.isBlank()) {
                text = safeExtractText(document);
            }
        } catch (InvalidPasswordException e) {
            throw new StatementImportException(StatementImportException.Stage.DECODING,
                    "Archivo PDF protegido por contraseña", e);
        } catch (IOException e) {
            throw new StatementImportException(StatementImportException.Stage.DECODING,
                    "No se pudo abrir el PDF: " + e.getMessage(), e);
        }

        text = text == null ? "" : text;
        logExtractedTextIfEnabled(filename, text);

        if (text.isBlank()) {
            diagnostics.add("No se pudo extraer texto del PDF. Puede estar escaneado (imagen).");
            return new ExtractedStatement(BankDetector.UNKNOWN, "", List.of(), text);
        }

        String bank = bankDetector.detect(text);
        String account = AccountNumberExtractor.extract(text);
        BankStatementLineParser parser = selectParser(bank);

        List<String> lines = StatementLineSplitter.splitLinesSmart(text, bank);
        List<BankTransaction> transactions = parser.parse(lines, diagnostics);

        log.info("[PdfAdapter] file='{}' bank={} parser={} lines={} transactions={}",
                filename, bank, parser.getClass().getSimpleName(), lines.size(), transactions.size());

        return new ExtractedStatement(bank, account, transactions, text);
    }

    /**
     * A bank-specific parser when one exists for the bank, the generic one otherwise.
     */
    BankStatementLineParser selectParser(String bank) {
        for (BankStatementLineParser candidate : lineParsers) {
            if (candidate == genericParser) continue;
            if (candidate.isApplicable(bank)) return candidate;
        }
        return genericParser;
    }

    private String safeExtractText(PDDocument document) {
        try {
            return pdfTextExtractor.extractText(document);
        } catch (IOException e) {
            log.warn("[PdfAdapter] plain text extraction failed: {}", e.getMessage());
            return "";
        }
    }

    private String safeExtractTextSorted(PDDocument document) {
        try {
            return pdfTextExtractor.extractTextSorted(document);
        } catch (IOException e) {
            log.warn("[PdfAdapter] sorted text extraction failed: {}", e.getMessage());
            return "";
        }
    }

    private void logExtractedTextIfEnabled(String filename, String text) {
        ImportProperties.Debug debug = importProperties.getDebug();
        if (!debug.isLogExtractedText()) return;
        int max = Math.min(text.length(), debug.getExtractedTextMaxChars());
        log.info("[PdfAdapter] extracted text file='{}' chars={} sample:\n{}", filename, text.length(), text.substring(0, max));
    }
}
