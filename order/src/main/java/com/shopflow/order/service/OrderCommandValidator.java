package com.shopflow.order.service;

import com.shopflow.order.domain.CreateOrderCommand;
import com.shopflow.order.domain.OrderValidationException;
import com.shopflow.order.domain.OrderValidationException.FieldViolation;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Runs the command's Bean Validation constraints and reports all violations at once,
 * ordered by field path.
 */
@Component
@RequiredArgsConstructor
public class OrderCommandValidator {

    private final Validator validator;

    public void validate(CreateOrderCommand command) {
        if (command == null) {
            throw new OrderValidationException(List.of(new FieldViolation("command", "must not be null")));
        }

        Set<ConstraintViolation<CreateOrderCommand>> violations = validator.validate(command);
        if (violations.isEmpty()) {
            return;
        }

        List<FieldViolation> fields = violations.stream()
                .map(v -> new FieldViolation(v.getPropertyPath().toString(), v.getMessage()))
                .sorted(Comparator.comparing(FieldViolation::getField).thenComparing(FieldViolation::getMessage))
                .toList();
        throw new OrderValidationException(fields);
    }
}
