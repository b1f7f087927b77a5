package org.caureq.homesentry.service.alerts;

import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.domain.Status;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Requires N consecutive bad observations before a key may alert, so a single failed
 * probe that recovers on the next check stays quiet. Recoveries are never delayed.
 * <p>
 * State lives only in memory: a restart starts every key from zero.
 */
@Slf4j
@Component
public class GracePeriodTracker {
    private final Map<String, PendingState> pending = new ConcurrentHashMap<>();
    private final AlertConfigService cfg;
    private final Clock clock;

    public GracePeriodTracker(AlertConfigService cfg, Clock clock) {
        this.cfg = cfg;
        this.clock = clock;
    }

    public GraceDecision evaluate(String eventKey, Status current, Status prev) {
        int threshold = Math.max(1, cfg.getGraceChecks());

        if (current == Status.OK) {
            var dropped = pending.remove(eventKey);
            if (dropped != null) {
                log.info("[Grace] {} recovered during grace period ({}/{}) - discarding pending state",
                        eventKey, dropped.getConsecutiveChecks(), threshold);
            }
            return new GraceDecision(true, "Recovery to OK - immediate alert");
        }

        var state = pending.get(eventKey);
        if (state == null) {
            if (prev == null || prev == Status.OK) {
                if (threshold <= 1) {
                    return new GraceDecision(true, "Grace period passed (1 check)");
                }
                pending.put(eventKey, new PendingState(eventKey, current, prev, clock.instant(), 1));
                log.info("[Grace] started for {} ({} -> {}, 1/{})", eventKey, prev, current, threshold);
                return new GraceDecision(false, "Started grace period (1/" + threshold + ")");
            }
            // bad -> bad with nothing tracked; callers should not produce this
            log.warn("[Grace] {} -> {} for {} without pending state - proceeding with alert", prev, current, eventKey);
            return new GraceDecision(true, "Status change detected (not in grace period)");
        }

        state.setConsecutiveChecks(state.getConsecutiveChecks() + 1);
        state.setBadStatus(current);
        if (state.getConsecutiveChecks() >= threshold) {
            pending.remove(eventKey);
            log.info("[Grace] passed for {} ({} consecutive checks, now {})",
                    eventKey, state.getConsecutiveChecks(), current);
            return new GraceDecision(true, "Grace period passed (" + state.getConsecutiveChecks() + " checks)");
        }
        log.info("[Grace] {} in grace period ({}/{}, now {})", eventKey, state.getConsecutiveChecks(), threshold, current);
        return new GraceDecision(false, "In grace period (" + state.getConsecutiveChecks() + "/" + threshold + ")");
    }

    /**
     * Keeps a key at its threshold after the alert it earned could not be delivered,
     * so the next bad observation proceeds straight away.
     */
    public void retain(String eventKey, Status current, Status prev) {
        int threshold = Math.max(1, cfg.getGraceChecks());
        pending.put(eventKey, new PendingState(eventKey, current, prev, clock.instant(), threshold));
        log.info("[Grace] {} kept at threshold ({}) after failed delivery", eventKey, threshold);
    }

    public void clear(String eventKey) {
        if (pending.remove(eventKey) != null) log.debug("[Grace] cleared pending state for {}", eventKey);
    }

    /** Copy of the tracked states, for the admin API. */
    public Map<String, PendingState> pendingStates() {
        return pending.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().copy()));
    }

    public int reset() {
        int n = pending.size();
        pending.clear();
        return n;
    }
}
