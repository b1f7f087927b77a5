package org.caureq.homesentry.repo;

import org.caureq.homesentry.domain.EventRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface EventRepo extends JpaRepository<EventRecord, Long> {
    Optional<EventRecord> findFirstByEventKeyOrderByIdDesc(String eventKey);
    Page<EventRecord> findAll(Pageable pageable);
    Page<EventRecord> findByEventKey(String eventKey, Pageable pageable);
}
