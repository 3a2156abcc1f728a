package com.finanalytix.backend.services.bankstatements.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-fatal problems found while importing one file, in the order they happened.
 * One instance per import call.
 */
public class ImportDiagnostics {

    private final List<String> errors = new ArrayList<>();

    public void add(String message) {
        if (message != null && !message.isBlank()) {
            errors.add(message);
        }
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }
}
