package org.caureq.homesentry.service.collect;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/** All {@link Collector} beans in the context, in declaration order. */
@Slf4j
@Component
public class CollectorRegistry {
    private final List<Collector> collectors;

    @Autowired
    public CollectorRegistry(ObjectProvider<Collector> provider) {
        this(provider.orderedStream().toList());
    }

    public CollectorRegistry(List<Collector> collectors) {
        this.collectors = List.copyOf(collectors);
        log.info("[Collect] {} collector(s) registered: {}", this.collectors.size(),
                this.collectors.stream().map(c -> c.name() + "/" + c.cadence()).toList());
    }

    public List<Collector> all() {
        return collectors;
    }

    /** Collectors due on a tick: every-tick ones always, the slow ones when their cadence fires. */
    public List<Collector> dueOn(boolean driveHealth, boolean arrayHealth) {
        return collectors.stream()
                .filter(c -> switch (c.cadence()) {
                    case EVERY_TICK -> true;
                    case DRIVE_HEALTH -> driveHealth;
                    case ARRAY_HEALTH -> arrayHealth;
                })
                .toList();
    }
}
