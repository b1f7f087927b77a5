package org.caureq.homesentry.service;

import org.caureq.homesentry.api.dto.ObservationDTO;
import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.Status;
import org.caureq.homesentry.service.collect.PushedObservationCollector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestServiceTest {

    private final PushedObservationCollector pushed = new PushedObservationCollector();
    private final IngestService service = new IngestService(pushed);

    @Test
    void shouldQueueObservationsForNextTick() {
        int n = service.ingest(List.of(
                new ObservationDTO("Service", " plex ", "fail", Map.of("http_code", 503)),
                new ObservationDTO("raid", "md0", "OK", null)));

        assertThat(n).isEqualTo(2);
        assertThat(pushed.collect()).satisfiesExactly(
                o -> {
                    assertThat(o.category()).isEqualTo(Category.SERVICE);
                    assertThat(o.name()).isEqualTo("plex");
                    assertThat(o.status()).isEqualTo(Status.FAIL);
                    assertThat(o.details()).containsEntry("http_code", 503);
                },
                o -> assertThat(o.eventKey()).isEqualTo("raid_md0"));
    }

    @Test
    void shouldRejectWholeBatchOnUnknownCategory() {
        assertThatThrownBy(() -> service.ingest(List.of(
                new ObservationDTO("service", "plex", "OK", null),
                new ObservationDTO("printer", "hp", "OK", null))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("printer");

        assertThat(pushed.pending()).isZero();
    }
}
