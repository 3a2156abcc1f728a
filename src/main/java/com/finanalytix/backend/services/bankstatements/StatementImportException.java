package com.finanalytix.backend.services.bankstatements;

/**
 * Thrown when a statement import cannot produce any result at all.
 * Row-level problems never surface as this exception; they are reported as diagnostics.
 */
public class StatementImportException extends RuntimeException {

    public enum Stage {
        FORMAT_SELECTION,
        DECODING,
        INFRASTRUCTURE,
        PROCESSING
    }

    private final Stage stage;

    public StatementImportException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StatementImportException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
