package com.finanalytix.backend.services.bankstatements;

public class UnsupportedStatementFormatException extends StatementImportException {

    public UnsupportedStatementFormatException(String declaredType) {
        super(Stage.FORMAT_SELECTION,
                "Tipo de archivo no soportado: " + declaredType + ". Use PDF, CSV o Excel.");
    }
}
