package org.caureq.homesentry.scheduler;

import java.time.Duration;

/** Outcome of one collection pass. Cycle 0 is the startup pass. */
public record PassSummary(long cycle, int collectorsRun, int collectorsFailed, int observations,
                          int alertsSent, Duration elapsed) {}
