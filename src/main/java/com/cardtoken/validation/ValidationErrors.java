package com.cardtoken.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collects field-scoped validation findings in the order they were added.
 *
 * Validation never throws; callers inspect the collector afterwards and decide
 * whether to accept or reject the validated object.
 */
public class ValidationErrors {

    private final List<FieldError> errors = new ArrayList<>();

    public void add(String field, String message) {
        if (field == null || message == null) {
            throw new IllegalArgumentException("Field and message are required");
        }
        errors.add(FieldError.of(field, message));
    }

    public void add(FieldErrorCode code) {
        errors.add(FieldError.of(code));
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    /**
     * Messages recorded against one field, empty if the field has no findings.
     */
    public List<String> on(String field) {
        return errors.stream()
            .filter(error -> error.getField().equals(field))
            .map(FieldError::getMessage)
            .collect(Collectors.toList());
    }

    public boolean contains(FieldErrorCode code) {
        return errors.stream().anyMatch(error -> error.getCode() == code);
    }

    public List<FieldError> getFieldErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Messages grouped by field, fields in first-reported order.
     */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> byField = new LinkedHashMap<>();
        for (FieldError error : errors) {
            byField.computeIfAbsent(error.getField(), f -> new ArrayList<>()).add(error.getMessage());
        }
        return byField;
    }

    public List<String> fullMessages() {
        return errors.stream()
            .map(FieldError::getFullMessage)
            .collect(Collectors.toList());
    }

    public void clear() {
        errors.clear();
    }

    @Override
    public String toString() {
        return String.join(", ", fullMessages());
    }
}
