package org.caureq.homesentry.service.collect;

import org.caureq.homesentry.domain.Observation;

import java.util.List;

/**
 * Source of observations, invoked by the scheduler. Implementations may block; each call
 * runs on the collector pool with a bounded wait. A thrown exception only skips this
 * collector for the current tick.
 */
public interface Collector {

    String name();

    default Cadence cadence() {
        return Cadence.EVERY_TICK;
    }

    List<Observation> collect() throws Exception;
}
