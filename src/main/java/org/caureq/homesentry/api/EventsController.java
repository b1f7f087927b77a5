package org.caureq.homesentry.api;

import lombok.RequiredArgsConstructor;
import org.caureq.homesentry.api.dto.EventDTO;
import org.caureq.homesentry.api.dto.SampleDTO;
import org.caureq.homesentry.repo.AlertStore;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Read-only view of the event log and of the latest observations. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EventsController {
    static final int MAX_LIMIT = 100;

    private final AlertStore store;

    @GetMapping("/events")
    public List<EventDTO> events(@RequestParam(defaultValue = "20") int limit) {
        return store.recentEvents(clamp(limit)).stream().map(EventDTO::of).toList();
    }

    @GetMapping("/observations/latest")
    public List<SampleDTO> latest(@RequestParam(defaultValue = "50") int limit) {
        return store.latestSamples(clamp(limit)).stream().map(SampleDTO::of).toList();
    }

    static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
