package org.caureq.homesentry.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.config.HomeSentryProps;
import org.caureq.homesentry.domain.Observation;
import org.caureq.homesentry.repo.AlertStore;
import org.caureq.homesentry.service.RetentionService;
import org.caureq.homesentry.service.alerts.AlertService;
import org.caureq.homesentry.service.alerts.MorningDigestService;
import org.caureq.homesentry.service.collect.Collector;
import org.caureq.homesentry.service.collect.CollectorRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The monitoring loop. One pass at startup with every collector, then one tick per poll
 * interval; drive and array health run on every Nth tick. Each collector, each alert
 * evaluation, the digest check and the retention check fail independently of one another.
 * <p>
 * Stopping wakes the loop out of its sleep at once; a pass already in progress completes.
 */
@Slf4j
@Component
public class MonitorScheduler implements SmartLifecycle {
    private final CollectorRegistry registry;
    private final AlertService alerts;
    private final AlertStore store;
    private final MorningDigestService digest;
    private final RetentionService retention;
    private final AsyncTaskExecutor executor;
    private final Clock clock;
    private final SchedulerSettings settings;
    private final boolean autoStartup;

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicLong cycles = new AtomicLong();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile Thread thread;
    private volatile PassSummary lastPass;

    public MonitorScheduler(HomeSentryProps props, CollectorRegistry registry, AlertService alerts,
                            AlertStore store, MorningDigestService digest, RetentionService retention,
                            @Qualifier("collectorExecutor") AsyncTaskExecutor executor, Clock clock) {
        this.registry = registry;
        this.alerts = alerts;
        this.store = store;
        this.digest = digest;
        this.retention = retention;
        this.executor = executor;
        this.clock = clock;
        var s = props.schedulerOrEmpty();
        this.settings = SchedulerSettings.from(s);
        this.autoStartup = s.enabled() == null || s.enabled();
    }

    @Override
    public void start() {
        if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.RUNNING)) {
            log.warn("[Scheduler] start ignored, state={}", state.get());
            return;
        }
        Thread t = new Thread(this::loop, "homesentry-scheduler");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    @Override
    public void stop() {
        if (state.getAndSet(SchedulerState.CANCELLED) != SchedulerState.RUNNING) return;
        log.info("[Scheduler] stop requested");
        stopSignal.countDown();
        Thread t = thread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(settings.collectorTimeout().plusSeconds(5).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) log.warn("[Scheduler] loop still finishing its current pass");
        }
    }

    @Override
    public boolean isRunning() {
        return state.get() == SchedulerState.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    private void loop() {
        log.info("[Scheduler] started poll={}s smart={}s (every {} ticks) raid={}s (every {} ticks)",
                settings.pollInterval().toSeconds(),
                settings.smartInterval().toSeconds(), settings.smartEvery(),
                settings.raidInterval().toSeconds(), settings.raidEvery());
        try {
            runInitialPass();
            while (state.get() == SchedulerState.RUNNING) {
                if (stopSignal.await(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS)) break;
                safeTick(cycles.incrementAndGet());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("[Scheduler] loop terminated unexpectedly", e);
        } finally {
            state.set(SchedulerState.CANCELLED);
            log.info("[Scheduler] stopped after {} cycle(s)", cycles.get());
        }
    }

    /** Every collector, whatever its cadence, so nothing is silent right after boot. */
    public PassSummary runInitialPass() {
        log.info("[Scheduler] performing initial collection");
        var summary = collectAndAlert(0, registry.all());
        log.info("[Scheduler] initial collection completed in {} ms", summary.elapsed().toMillis());
        return summary;
    }

    /** A tick that throws is logged and skipped; the loop keeps its cadence. */
    void safeTick(long cycle) {
        try {
            runTick(cycle);
        } catch (RuntimeException e) {
            log.error("[Scheduler] cycle #{} failed, continuing with the next one", cycle, e);
        }
    }

    public PassSummary runTick(long cycle) {
        long started = System.nanoTime();
        boolean drive = cycle % settings.smartEvery() == 0;
        boolean array = cycle % settings.raidEvery() == 0;
        if (drive) log.info("[Scheduler] drive health collection (cycle #{})", cycle);
        if (array) log.info("[Scheduler] array health collection (cycle #{})", cycle);

        var pass = collectAndAlert(cycle, registry.dueOn(drive, array));

        LocalDateTime now = LocalDateTime.now(clock);
        try {
            digest.checkAndSend(now);
        } catch (RuntimeException e) {
            log.error("[Scheduler] morning digest check failed", e);
        }
        try {
            retention.runIfDue(now);
        } catch (RuntimeException e) {
            log.error("[Scheduler] retention cleanup failed", e);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        var summary = new PassSummary(cycle, pass.collectorsRun(), pass.collectorsFailed(),
                pass.observations(), pass.alertsSent(), elapsed);
        lastPass = summary;
        log.info("[Scheduler] cycle #{} completed in {} ms ({} observations, {} alerts)",
                cycle, elapsed.toMillis(), summary.observations(), summary.alertsSent());
        long budget = settings.pollInterval().toMillis();
        if (elapsed.toMillis() > budget * 0.8) {
            log.warn("[Scheduler] cycle took {} ms, {}% of the poll interval ({}s); consider increasing it",
                    elapsed.toMillis(), elapsed.toMillis() * 100 / budget, settings.pollInterval().toSeconds());
        }
        return summary;
    }

    private PassSummary collectAndAlert(long cycle, List<Collector> due) {
        long started = System.nanoTime();
        Map<Collector, Future<List<Observation>>> running = new LinkedHashMap<>();
        for (var c : due) {
            try {
                running.put(c, executor.submit(c::collect));
            } catch (RuntimeException e) {
                log.error("[Scheduler] could not submit collector {}", c.name(), e);
            }
        }

        long deadline = started + settings.collectorTimeout().toNanos();
        int failed = due.size() - running.size();
        int observations = 0;
        int sent = 0;
        for (var e : running.entrySet()) {
            String name = e.getKey().name();
            List<Observation> batch;
            try {
                long wait = Math.max(0, deadline - System.nanoTime());
                batch = e.getValue().get(wait, TimeUnit.NANOSECONDS);
            } catch (TimeoutException ex) {
                e.getValue().cancel(true);
                log.error("[Scheduler] collector {} timed out after {}s", name, settings.collectorTimeout().toSeconds());
                failed++;
                continue;
            } catch (ExecutionException ex) {
                log.error("[Scheduler] collector {} failed: {}", name, ex.getCause().toString(), ex.getCause());
                failed++;
                continue;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("[Scheduler] interrupted while waiting for collector {}", name);
                break;
            }
            if (batch == null) continue;
            for (var o : batch) {
                observations++;
                try {
                    store.recordSample(o);
                    if (alerts.process(o)) sent++;
                } catch (RuntimeException ex) {
                    log.error("[Scheduler] processing {} from {} failed", o.eventKey(), name, ex);
                }
            }
        }
        var summary = new PassSummary(cycle, running.size(), failed, observations, sent,
                Duration.ofNanos(System.nanoTime() - started));
        if (cycle == 0) lastPass = summary;
        return summary;
    }

    public SchedulerState getState() { return state.get(); }
    public long getCycles() { return cycles.get(); }
    public SchedulerSettings getSettings() { return settings; }
    public PassSummary getLastPass() { return lastPass; }
}
