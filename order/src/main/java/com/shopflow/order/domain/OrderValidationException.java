package com.shopflow.order.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every failed field of a create-order command, not just the first.
 */
@Getter
public class OrderValidationException extends RuntimeException {

    private final List<FieldViolation> violations;

    public OrderValidationException(List<FieldViolation> violations) {
        super("Order validation failed: " + violations.stream()
                .map(v -> v.getField() + " " + v.getMessage())
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    @Getter
    @ToString
    @EqualsAndHashCode
    @AllArgsConstructor
    public static class FieldViolation {
        private final String field;
        private final String message;
    }
}
