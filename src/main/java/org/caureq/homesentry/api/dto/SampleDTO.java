package org.caureq.homesentry.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.ObservationSample;
import org.caureq.homesentry.domain.Status;

import java.time.Instant;

public record SampleDTO(Long id, Category category, String name, Status status,
                        @JsonRawValue String details, Instant ts) {

    public static SampleDTO of(ObservationSample s) {
        String details = s.getDetails() == null || s.getDetails().isBlank() ? "{}" : s.getDetails();
        return new SampleDTO(s.getId(), s.getCategory(), s.getName(), s.getStatus(), details, s.getTs());
    }
}
