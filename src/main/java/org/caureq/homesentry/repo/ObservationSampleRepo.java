package org.caureq.homesentry.repo;

import org.caureq.homesentry.domain.ObservationSample;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface ObservationSampleRepo extends JpaRepository<ObservationSample, Long> {
    Page<ObservationSample> findAll(Pageable pageable);

    @Modifying
    @Query("delete from ObservationSample m where m.ts < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
