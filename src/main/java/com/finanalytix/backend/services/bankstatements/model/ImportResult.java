package com.finanalytix.backend.services.bankstatements.model;

import java.util.List;

public record ImportResult(
        ImportedStatement statement,
        List<String> diagnostics
) {
    public ImportResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
