package com.classmonitor.repository;

import com.classmonitor.model.Classroom;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Reactive repository for Classroom entity.
 */
@Repository
public interface ClassroomRepository extends ReactiveCrudRepository<Classroom, Long> {

    Mono<Classroom> findByName(String name);
}
