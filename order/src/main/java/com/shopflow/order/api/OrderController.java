package com.shopflow.order.api;

import com.shopflow.order.domain.CreateOrderCommand;
import com.shopflow.order.domain.Order;
import com.shopflow.order.domain.OrderCreationResult;
import com.shopflow.order.service.OrderCreationService;
import com.shopflow.order.service.OrderQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Order REST Controller
 *
 * POST /api/v1/orders                       → same pipeline as the checkout consumer
 * GET  /api/v1/orders/{orderId}
 * GET  /api/v1/orders/customer/{customerId}
 *
 * The body is not bound with @Valid; the pipeline validates and reports every field.
 */
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderCreationService creationService;
    private final OrderQueryService queryService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> createOrder(
            @RequestBody CreateOrderCommand command,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId) {

        if (correlationId != null && command.getCorrelationId() == null) {
            command.setCorrelationId(correlationId);
        }

        OrderCreationResult result = creationService.createOrder(command);

        return ResponseEntity
                .created(URI.create("/api/v1/orders/" + result.getOrderId()))
                .body(Map.of(
                        "orderId", result.getOrderId(),
                        "correlationId", result.getCorrelationId()
                ));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<Order> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(queryService.getOrder(orderId));
    }

    @GetMapping("/customer/{customerId}")
    public ResponseEntity<List<Order>> getOrdersByCustomer(@PathVariable String customerId) {
        return ResponseEntity.ok(queryService.getOrdersByCustomer(customerId));
    }
}
