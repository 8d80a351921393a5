package com.fintech.savings.domain.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-transaction validation failures. Never fatal: the transaction is excluded, not the request.
 */
public enum ValidationError {

    NEGATIVE_AMOUNT("Negative amounts are not allowed"),
    DUPLICATE("Duplicate transaction");

    public static final String DELIMITER = "; ";

    private final String message;

    ValidationError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public static String join(List<ValidationError> errors) {
        return errors.stream()
                .map(ValidationError::getMessage)
                .collect(Collectors.joining(DELIMITER));
    }
}
