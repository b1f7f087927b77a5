package org.caureq.homesentry.service.collect;

/** How often the scheduler runs a collector. */
public enum Cadence {
    /** every base tick: system, services, containers, app modules */
    EVERY_TICK,
    /** drive health (SMART) */
    DRIVE_HEALTH,
    /** array health (RAID) */
    ARRAY_HEALTH
}
