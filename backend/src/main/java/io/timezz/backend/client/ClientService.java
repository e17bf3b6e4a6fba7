package io.timezz.backend.client;

import io.timezz.backend.activity.ActivityLogService;
import io.timezz.backend.exception.InvalidStateException;
import io.timezz.backend.exception.ResourceNotFoundException;
import io.timezz.backend.timeentry.BillingCalculator;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ClientService {

  private static final Logger log = LoggerFactory.getLogger(ClientService.class);

  private final ClientRepository clientRepository;
  private final ActivityLogService activityLogService;
  private final Clock clock;

  public ClientService(
      ClientRepository clientRepository, ActivityLogService activityLogService, Clock clock) {
    this.clientRepository = clientRepository;
    this.activityLogService = activityLogService;
    this.clock = clock;
  }

  /** Editable client attributes. A {@code null} color falls back to the default. */
  public record ClientFields(
      String name,
      String email,
      String company,
      BigDecimal hourlyRate,
      String address,
      String phone,
      String notes,
      String color,
      Boolean active) {}

  @Transactional
  public Client create(UUID ownerId, ClientFields fields) {
    validate(fields);
    var client = new Client(ownerId, fields.name().trim(), clock.instant());
    apply(client, fields);
    client = clientRepository.save(client);

    activityLogService.record(
        ownerId,
        "client.created",
        ActivityLogService.ENTITY_CLIENT,
        client.getId(),
        Map.of("name", client.getName()));
    log.info("Created client {} for user {}", client.getId(), ownerId);
    return client;
  }

  @Transactional(readOnly = true)
  public List<Client> listClients(UUID ownerId) {
    return clientRepository.findByOwnerIdOrderByNameAsc(ownerId);
  }

  /** Clients of other users are reported as missing. */
  @Transactional(readOnly = true)
  public Client getClient(UUID ownerId, UUID clientId) {
    return clientRepository
        .findByIdAndOwnerId(clientId, ownerId)
        .orElseThrow(() -> new ResourceNotFoundException("Client", clientId));
  }

  @Transactional
  public Client update(UUID ownerId, UUID clientId, ClientFields fields) {
    validate(fields);
    var client = getClient(ownerId, clientId);

    var details = new LinkedHashMap<String, Object>();
    if (!Objects.equals(client.getName(), fields.name().trim())) {
      details.put("name", Map.of("from", client.getName(), "to", fields.name().trim()));
    }
    if (fields.active() != null && fields.active() != client.isActive()) {
      details.put("active", fields.active());
    }
    apply(client, fields);
    client = clientRepository.save(client);

    activityLogService.record(
        ownerId, "client.updated", ActivityLogService.ENTITY_CLIENT, client.getId(), details);
    log.info("Updated client {} for user {}", client.getId(), ownerId);
    return client;
  }

  private void apply(Client client, ClientFields fields) {
    client.update(
        fields.name().trim(),
        fields.email(),
        fields.company(),
        BillingCalculator.snapshotRate(fields.hourlyRate()),
        fields.address(),
        fields.phone(),
        fields.notes(),
        fields.color());
    if (fields.active() != null) {
      client.changeActive(fields.active());
    }
    client.touch(clock.instant());
  }

  private static void validate(ClientFields fields) {
    if (fields.name() == null || fields.name().isBlank()) {
      throw new InvalidStateException("Invalid client", "Client name is required");
    }
    BillingCalculator.requireValidRate(fields.hourlyRate());
  }
}
