package com.finanalytix.backend.services.bankstatements;

/**
 * The runtime cannot read the requested format (library missing or format disabled).
 */
public class ImportInfrastructureUnavailableException extends StatementImportException {

    public ImportInfrastructureUnavailableException(String message) {
        super(Stage.INFRASTRUCTURE, message);
    }
}
