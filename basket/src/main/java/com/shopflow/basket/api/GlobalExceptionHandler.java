package com.shopflow.basket.api;

import com.shopflow.basket.domain.BasketNotFoundException;
import com.shopflow.basket.domain.CheckoutPublishException;
import com.shopflow.basket.repository.RedisBasketStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BasketNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleBasketNotFound(BasketNotFoundException e) {
        log.warn("Basket not found: userName={}", e.getUserName());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("BASKET_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(CheckoutPublishException.class)
    public ResponseEntity<ErrorResponse> handleCheckoutPublish(CheckoutPublishException e) {
        // Already logged at error level with reconciliation context by CheckoutService
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of("CHECKOUT_PUBLISH_FAILED", e.getMessage(),
                        Map.of("userName", e.getUserName(), "totalPrice", e.getTotalPrice())));
    }

    @ExceptionHandler(RedisBasketStore.BasketStoreException.class)
    public ResponseEntity<ErrorResponse> handleBasketStore(RedisBasketStore.BasketStoreException e) {
        log.error("Basket store error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("BASKET_STORE_ERROR", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException e) {
        List<Map<String, String>> fields = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> Map.of("field", fe.getField(),
                        "message", String.valueOf(fe.getDefaultMessage())))
                .toList();
        log.warn("Invalid basket request: fields={}", fields);
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("INVALID_INPUT", "Request validation failed", fields));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("MALFORMED_REQUEST", "Request body could not be read"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected exception occurred", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_SERVER_ERROR", "Internal server error"));
    }
}
