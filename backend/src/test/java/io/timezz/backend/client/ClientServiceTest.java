package io.timezz.backend.client;

import static io.timezz.backend.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.timezz.backend.MutableClock;
import io.timezz.backend.activity.ActivityLogService;
import io.timezz.backend.exception.InvalidStateException;
import io.timezz.backend.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ClientServiceTest {

  private static final UUID OWNER_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2025-03-05T10:00:00Z");

  @Mock private ClientRepository clientRepository;
  @Mock private ActivityLogService activityLogService;

  private MutableClock clock;
  private ClientService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    service = new ClientService(clientRepository, activityLogService, clock);
  }

  @Test
  void create_appliesDefaultsAndRecordsActivity() {
    when(clientRepository.save(any(Client.class)))
        .thenAnswer(inv -> withId(inv.getArgument(0, Client.class), UUID.randomUUID()));

    var client =
        service.create(
            OWNER_ID,
            new ClientService.ClientFields(
                "  Acme  ",
                "billing@acme.test",
                "Acme Corp",
                new BigDecimal("95.5"),
                null,
                null,
                null,
                null,
                null));

    assertThat(client.getName()).isEqualTo("Acme");
    assertThat(client.getOwnerId()).isEqualTo(OWNER_ID);
    assertThat(client.getColor()).isEqualTo(Client.DEFAULT_COLOR);
    assertThat(client.isActive()).isTrue();
    assertThat(client.getHourlyRate()).isEqualTo(new BigDecimal("95.50"));
    assertThat(client.getCreatedAt()).isEqualTo(NOW);
    verify(activityLogService)
        .record(
            eq(OWNER_ID),
            eq("client.created"),
            eq(ActivityLogService.ENTITY_CLIENT),
            eq(client.getId()),
            anyMap());
  }

  @Test
  void create_rejectsBlankName() {
    assertThatThrownBy(() -> service.create(OWNER_ID, fields(" ", null)))
        .isInstanceOf(InvalidStateException.class);
    verify(clientRepository, never()).save(any());
  }

  @Test
  void create_rejectsRateAboveMaximum() {
    assertThatThrownBy(
            () -> service.create(OWNER_ID, fields("Acme", new BigDecimal("100000.01"))))
        .isInstanceOf(InvalidStateException.class);
    verify(clientRepository, never()).save(any());
  }

  @Test
  void getClient_hidesClientsOfOtherUsers() {
    var clientId = UUID.randomUUID();
    when(clientRepository.findByIdAndOwnerId(clientId, OWNER_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getClient(OWNER_ID, clientId))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void update_canDeactivateAndStampsUpdatedAt() {
    var clientId = UUID.randomUUID();
    var client = withId(new Client(OWNER_ID, "Acme", NOW), clientId);
    when(clientRepository.findByIdAndOwnerId(clientId, OWNER_ID)).thenReturn(Optional.of(client));
    when(clientRepository.save(client)).thenReturn(client);
    clock.advance(Duration.ofDays(2));

    var updated =
        service.update(
            OWNER_ID,
            clientId,
            new ClientService.ClientFields(
                "Acme Ltd", null, null, null, null, null, null, "#112233", false));

    assertThat(updated.getName()).isEqualTo("Acme Ltd");
    assertThat(updated.isActive()).isFalse();
    assertThat(updated.getColor()).isEqualTo("#112233");
    assertThat(updated.getCreatedAt()).isEqualTo(NOW);
    assertThat(updated.getUpdatedAt()).isEqualTo(NOW.plus(Duration.ofDays(2)));
    verify(activityLogService)
        .record(
            eq(OWNER_ID),
            eq("client.updated"),
            eq(ActivityLogService.ENTITY_CLIENT),
            eq(clientId),
            anyMap());
  }

  private static ClientService.ClientFields fields(String name, BigDecimal rate) {
    return new ClientService.ClientFields(name, null, null, rate, null, null, null, null, null);
  }
}
