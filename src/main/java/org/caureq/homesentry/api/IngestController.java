package org.caureq.homesentry.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.homesentry.api.dto.IngestRequest;
import org.caureq.homesentry.service.IngestService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Push endpoint for external probes. Requires X-API-KEY. */
@RestController
@RequestMapping("/api/observations")
@RequiredArgsConstructor
public class IngestController {
    private final IngestService ingestService;

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> ingest(@Valid @RequestBody IngestRequest body) {
        int accepted = ingestService.ingest(body.observations());
        return Map.of("accepted", accepted, "received", body.observations().size());
    }
}
