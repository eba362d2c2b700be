package com.shopflow.shared.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface OutboxRepository extends JpaRepository<OutboxRecord, String> {

    /**
     * Pending rows whose next attempt is due, earliest first.
     * SKIP LOCKED lets several relay instances drain disjoint batches.
     */
    @Query(value = """
        SELECT * FROM checkout_outbox
        WHERE status = 'PENDING'
          AND next_attempt_at <= :now
        ORDER BY next_attempt_at ASC, staged_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxRecord> findDueForRelay(@Param("now") Instant now, @Param("limit") int limit);
}
