package io.timezz.backend.client;

import io.timezz.backend.report.ReportService;
import io.timezz.backend.report.dto.ClientSummary;
import io.timezz.backend.security.UserContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/clients")
public class ClientController {

  private final ClientService clientService;
  private final ReportService reportService;

  public ClientController(ClientService clientService, ReportService reportService) {
    this.clientService = clientService;
    this.reportService = reportService;
  }

  @GetMapping
  public ResponseEntity<List<ClientResponse>> listClients() {
    UUID userId = UserContext.requireUserId();
    var summaries = reportService.clientSummaries(userId);
    var clients =
        clientService.listClients(userId).stream()
            .map(
                c ->
                    ClientResponse.from(
                        c, summaries.getOrDefault(c.getId(), ClientSummary.empty(c.getId()))))
            .toList();
    return ResponseEntity.ok(clients);
  }

  @PostMapping
  public ResponseEntity<ClientResponse> createClient(@Valid @RequestBody ClientRequest request) {
    var client = clientService.create(UserContext.requireUserId(), request.toFields());
    return ResponseEntity.created(URI.create("/api/v1/clients/" + client.getId()))
        .body(ClientResponse.from(client, ClientSummary.empty(client.getId())));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ClientResponse> getClient(@PathVariable UUID id) {
    UUID userId = UserContext.requireUserId();
    var client = clientService.getClient(userId, id);
    var summary = reportService.clientSummaries(userId).getOrDefault(id, ClientSummary.empty(id));
    return ResponseEntity.ok(ClientResponse.from(client, summary));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ClientResponse> updateClient(
      @PathVariable UUID id, @Valid @RequestBody ClientRequest request) {
    UUID userId = UserContext.requireUserId();
    var client = clientService.update(userId, id, request.toFields());
    var summary = reportService.clientSummaries(userId).getOrDefault(id, ClientSummary.empty(id));
    return ResponseEntity.ok(ClientResponse.from(client, summary));
  }

  // --- DTOs ---

  public record ClientRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Email(message = "email must be a valid address") @Size(max = 255) String email,
      @Size(max = 255) String company,
      @PositiveOrZero(message = "hourlyRate must not be negative")
          @DecimalMax(value = "100000.00", message = "hourlyRate must not exceed 100000.00")
          @Digits(integer = 6, fraction = 2, message = "hourlyRate has at most 2 decimals")
          BigDecimal hourlyRate,
      String address,
      @Size(max = 50) String phone,
      String notes,
      @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "color must be a hex color like #0079bf")
          String color,
      Boolean active) {

    ClientService.ClientFields toFields() {
      return new ClientService.ClientFields(
          name, email, company, hourlyRate, address, phone, notes, color, active);
    }
  }

  public record ClientResponse(
      UUID id,
      String name,
      String email,
      String company,
      BigDecimal hourlyRate,
      String address,
      String phone,
      String notes,
      String color,
      boolean active,
      long projectCount,
      double totalHours,
      BigDecimal totalEarnings,
      Instant createdAt,
      Instant updatedAt) {

    public static ClientResponse from(Client client, ClientSummary summary) {
      return new ClientResponse(
          client.getId(),
          client.getName(),
          client.getEmail(),
          client.getCompany(),
          client.getHourlyRate(),
          client.getAddress(),
          client.getPhone(),
          client.getNotes(),
          client.getColor(),
          client.isActive(),
          summary.projectCount(),
          summary.totalHours(),
          summary.totalEarnings(),
          client.getCreatedAt(),
          client.getUpdatedAt());
    }
  }
}
