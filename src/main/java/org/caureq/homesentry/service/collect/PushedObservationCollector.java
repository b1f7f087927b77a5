package org.caureq.homesentry.service.collect;

import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.domain.Observation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds observations pushed by external probes through the ingest API until the next tick.
 * Bounded; once full, new observations are rejected.
 */
@Slf4j
@Component
public class PushedObservationCollector implements Collector {
    static final int CAPACITY = 10_000;

    private final ConcurrentLinkedQueue<Observation> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger();

    @Override
    public String name() {
        return "ingest";
    }

    /** @return how many were accepted */
    public int push(List<Observation> observations) {
        int accepted = 0;
        for (var o : observations) {
            if (size.incrementAndGet() > CAPACITY) {
                size.decrementAndGet();
                log.warn("[Collect] ingest buffer full ({}), dropping {} observation(s)",
                        CAPACITY, observations.size() - accepted);
                break;
            }
            queue.add(o);
            accepted++;
        }
        return accepted;
    }

    public int pending() {
        return size.get();
    }

    @Override
    public List<Observation> collect() {
        List<Observation> out = new ArrayList<>();
        Observation o;
        while ((o = queue.poll()) != null) {
            size.decrementAndGet();
            out.add(o);
        }
        return out;
    }
}
