package com.finanalytix.backend.services.bankstatements.adapters;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import com.finanalytix.backend.config.ImportProperties;
import com.finanalytix.backend.services.bankstatements.StatementFileType;
import com.finanalytix.backend.services.bankstatements.StatementImportException;
import com.finanalytix.backend.services.bankstatements.model.BankTransaction;
import com.finanalytix.backend.services.bankstatements.model.ImportDiagnostics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class CsvStatementAdapter implements StatementFormatAdapter {

    public static final String BANK_NAME = "CSV";

    private static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};

    private final TabularRowReader tabularRowReader;
    private final ImportProperties importProperties;

    @Override
    public StatementFileType fileType() {
        return StatementFileType.CSV;
    }

    @Override
    public ExtractedStatement extract(byte[] bytes, String filename, ImportDiagnostics diagnostics) {
        String content = decodeUtf8(bytes);
        char delimiter = detectDelimiter(content, importProperties.getCsv().getDelimiterSampleSize());

        log.info("[CsvAdapter] file='{}' chars={} delimiter='{}'", filename, content.length(), printable(delimiter));

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                .build();

        List<BankTransaction> transactions = new ArrayList<>();

        try (CSVParser parser = format.parse(new StringReader(content))) {
            HeaderMapping mapping = HeaderMapping.resolve(parser.getHeaderNames());
            log.debug("[CsvAdapter] header mapping={}", mapping.columns());

            Iterator<CSVRecord> records = parser.iterator();
            while (true) {
                CSVRecord record;
                try {
                    if (!records.hasNext()) break;
                    record = records.next();
                } catch (RuntimeException e) {
                    // Broken quoting leaves the reader in an unknown position; keep what was read so far.
                    diagnostics.add("Error leyendo CSV: " + e.getMessage());
                    break;
                }

                try {
                    BankTransaction tx = tabularRowReader.read(mapping, record.toList());
                    if (tx != null) {
                        transactions.add(tx);
                    }
                } catch (RuntimeException e) {
                    diagnostics.add("Error parseando fila " + (record.getRecordNumber() + 1) + ": " + e.getMessage());
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new StatementImportException(StatementImportException.Stage.DECODING,
                    "No se pudo leer el encabezado del CSV: " + e.getMessage(), e);
        }

        log.info("[CsvAdapter] parsed {} transactions, {} diagnostics", transactions.size(), diagnostics.size());
        return new ExtractedStatement(BANK_NAME, "", transactions, content);
    }

    static String decodeUtf8(byte[] bytes) {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes == null ? new byte[0] : bytes))
                    .toString();
            return text.startsWith("\uFEFF") ? text.substring(1) : text;
        } catch (CharacterCodingException e) {
            throw new StatementImportException(StatementImportException.Stage.DECODING,
                    "El archivo CSV no está codificado en UTF-8", e);
        }
    }

    /**
     * Picks the candidate delimiter that occurs most often in the leading sample; comma on ties.
     */
    static char detectDelimiter(String content, int sampleSize) {
        String sample = content.substring(0, Math.min(content.length(), Math.max(0, sampleSize)));

        char best = ',';
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = 0;
            for (int i = 0; i < sample.length(); i++) {
                if (sample.charAt(i) == candidate) count++;
            }
            if (count > bestCount) {
                bestCount = count;
                best = candidate;
            }
        }
        return best;
    }

    private static String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }
}
