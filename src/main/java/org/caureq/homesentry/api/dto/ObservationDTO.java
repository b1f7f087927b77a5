package org.caureq.homesentry.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record ObservationDTO(
        @NotBlank String category,          // service, system, disk, docker, smart, raid, app
        @NotBlank @Size(max = 200) String name,
        @NotBlank String status,            // OK, WARN, FAIL
        Map<String, Object> details
) {}
