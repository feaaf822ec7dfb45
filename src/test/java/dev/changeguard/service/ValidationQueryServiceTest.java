package dev.changeguard.service;

import dev.changeguard.domain.entity.ValidationRequest;
import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.domain.valueobject.ValidationStats;
import dev.changeguard.dto.response.ValidationResponse;
import dev.changeguard.store.ValidationStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ValidationQueryServiceTest {

    private final ValidationStore store = mock(ValidationStore.class);
    private final ValidationQueryService service = new ValidationQueryService(store);

    @Test
    @DisplayName("maps a stored request to its response")
    void findByChangeId() {
        ValidationRequest request = ValidationRequest.receive("chg-1", "CHG0001", "cmdb_ci", "ci-1", "{}", null, "bob");
        when(store.findByChangeId("chg-1")).thenReturn(Optional.of(request));

        ValidationResponse response = service.findByChangeId("chg-1").orElseThrow();

        assertThat(response.id()).isEqualTo(request.getId());
        assertThat(response.componentType()).isEqualTo("cmdb_ci");
        assertThat(response.status()).isEqualTo(ValidationStatus.RECEIVED);
        assertThat(response.requestedBy()).isEqualTo("bob");
    }

    @Test
    @DisplayName("limits are capped and windows are converted to days")
    void limitsAndWindows() {
        when(store.findRecentByStatus(ValidationStatus.FAILED, Duration.ofDays(3), ValidationQueryService.MAX_LIMIT))
                .thenReturn(List.of());
        when(store.stats(Duration.ofDays(30)))
                .thenReturn(new ValidationStats(Duration.ofDays(30), 4, 2, 1, 1, 0, 0, 12.5));

        service.findRecentByStatus(ValidationStatus.FAILED, 3, 10_000);

        verify(store).findRecentByStatus(ValidationStatus.FAILED, Duration.ofDays(3), ValidationQueryService.MAX_LIMIT);
        assertThat(service.stats(30).days()).isEqualTo(30);
    }

    @Test
    @DisplayName("out-of-range arguments are rejected")
    void invalidArguments() {
        assertThatThrownBy(() -> service.stats(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.stats(400)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.findByComponentType("workflow", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
