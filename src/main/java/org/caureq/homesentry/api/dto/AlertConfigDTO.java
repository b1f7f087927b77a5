package org.caureq.homesentry.api.dto;

import jakarta.validation.constraints.Min;

/** Runtime alert settings; null fields in an update are left unchanged. */
public record AlertConfigDTO(
        Boolean alertsEnabled,
        @Min(0) Integer cooldownMinutes,
        Boolean gracePeriodEnabled,
        @Min(1) Integer graceChecks
) {}
