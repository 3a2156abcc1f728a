package com.finanalytix.backend.services.bankstatements;

import org.springframework.stereotype.Component;

import com.finanalytix.backend.config.ImportProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers whether PDF and spreadsheet statements can be read in this runtime.
 * A format is available when its library is on the classpath and it is enabled in configuration.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImportCapabilities {

    static final String PDF_LIBRARY_CLASS = "org.apache.pdfbox.pdmodel.PDDocument";
    static final String SPREADSHEET_LIBRARY_CLASS = "org.apache.poi.ss.usermodel.WorkbookFactory";

    private final ImportProperties importProperties;

    public boolean isPdfAvailable() {
        return importProperties.getPdf().isEnabled() && isOnClasspath(PDF_LIBRARY_CLASS);
    }

    public boolean isSpreadsheetAvailable() {
        return importProperties.getSpreadsheet().isEnabled() && isOnClasspath(SPREADSHEET_LIBRARY_CLASS);
    }

    /**
     * @throws ImportInfrastructureUnavailableException when the type cannot be read here
     */
    public void requireSupport(StatementFileType type) {
        switch (type) {
            case PDF -> {
                if (!isPdfAvailable()) {
                    throw new ImportInfrastructureUnavailableException(
                            "Importación de PDF no disponible: PDFBox ausente o finanalytix.import.pdf.enabled=false");
                }
            }
            case EXCEL -> {
                if (!isSpreadsheetAvailable()) {
                    throw new ImportInfrastructureUnavailableException(
                            "Importación de Excel no disponible: Apache POI ausente o finanalytix.import.spreadsheet.enabled=false");
                }
            }
            case CSV -> {
                // Commons CSV is a hard dependency.
            }
        }
    }

    static boolean isOnClasspath(String className) {
        try {
            Class.forName(className, false, ImportCapabilities.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            log.warn("[ImportCapabilities] {} not available: {}", className, e.getMessage());
            return false;
        }
    }
}
