package org.caureq.homesentry.repo;

import org.caureq.homesentry.domain.SleepEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface SleepEventRepo extends JpaRepository<SleepEvent, Long> {
    List<SleepEvent> findAllByOrderByCreatedAtAscIdAsc();

    @Modifying
    @Query("delete from SleepEvent s where s.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
