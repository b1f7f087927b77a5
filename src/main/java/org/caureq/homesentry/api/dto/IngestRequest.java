package org.caureq.homesentry.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record IngestRequest(
        @NotEmpty @Size(max = 500) List<@Valid ObservationDTO> observations
) {}
