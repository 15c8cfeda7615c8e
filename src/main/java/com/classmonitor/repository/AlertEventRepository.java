package com.classmonitor.repository;

import com.classmonitor.model.AlertEvent;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Reactive repository for AlertEvent entity.
 */
@Repository
public interface AlertEventRepository extends ReactiveCrudRepository<AlertEvent, Long> {

    /**
     * Find events raised for one source, newest first
     */
    Flux<AlertEvent> findBySourceKeyOrderByCreatedAtDesc(String sourceKey);

    /**
     * Find recent events (paginated)
     */
    @Query("SELECT * FROM alert_events ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<AlertEvent> findRecentEvents(int limit, int offset);
}
