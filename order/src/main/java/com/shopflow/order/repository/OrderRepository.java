package com.shopflow.order.repository;

import com.shopflow.order.domain.Order;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, String> {

    @EntityGraph(attributePaths = "items")
    Optional<Order> findWithItemsById(String id);

    @EntityGraph(attributePaths = "items")
    List<Order> findByCustomerIdOrderByCreatedAtDesc(String customerId);

    Optional<Order> findBySourceEventId(String sourceEventId);
}
