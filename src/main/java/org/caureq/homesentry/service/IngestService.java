package org.caureq.homesentry.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.api.dto.ObservationDTO;
import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.Observation;
import org.caureq.homesentry.domain.Status;
import org.caureq.homesentry.service.collect.PushedObservationCollector;
import org.springframework.stereotype.Service;

import java.util.List;

/** Accepts observations from external probes; they are evaluated on the next scheduler tick. */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestService {
    private final PushedObservationCollector pushed;

    /**
     * @return number of observations queued
     * @throws IllegalArgumentException on an unknown category or status
     */
    public int ingest(List<ObservationDTO> batch) {
        var observations = batch.stream().map(IngestService::toObservation).toList();
        int accepted = pushed.push(observations);
        log.debug("ingested {}/{} observation(s)", accepted, observations.size());
        return accepted;
    }

    static Observation toObservation(ObservationDTO d) {
        return new Observation(Category.parse(d.category()), d.name().trim(), Status.parse(d.status()), d.details());
    }
}
