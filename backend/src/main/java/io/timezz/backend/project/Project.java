package io.timezz.backend.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project {

  public static final String DEFAULT_COLOR = "#0079bf";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private UUID ownerId;

  @Column(name = "client_id")
  private UUID clientId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "trello_board_id", length = 255)
  private String trelloBoardId;

  @Column(name = "color", nullable = false, length = 7)
  private String color;

  @Column(name = "hourly_rate", precision = 12, scale = 2)
  private BigDecimal hourlyRate;

  @Column(name = "billable_by_default", nullable = false)
  private boolean billableByDefault;

  @Column(name = "budget_hours")
  private Double budgetHours;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProjectStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Project() {}

  public Project(
      UUID ownerId, String name, String description, String trelloBoardId, Instant createdAt) {
    this.ownerId = ownerId;
    this.name = name;
    this.description = description;
    this.trelloBoardId = trelloBoardId;
    this.color = DEFAULT_COLOR;
    this.billableByDefault = true;
    this.status = ProjectStatus.ACTIVE;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  /** Rate applied to entries of this project, or {@code null} to fall back to the owner's. */
  public BigDecimal effectiveRate() {
    return hourlyRate != null && hourlyRate.signum() > 0 ? hourlyRate : null;
  }

  public void update(
      String name,
      String description,
      String trelloBoardId,
      String color,
      BigDecimal hourlyRate,
      boolean billableByDefault,
      Double budgetHours,
      ProjectStatus status) {
    this.name = name;
    this.description = description;
    this.trelloBoardId = trelloBoardId;
    this.color = color != null ? color : DEFAULT_COLOR;
    this.hourlyRate = hourlyRate;
    this.billableByDefault = billableByDefault;
    this.budgetHours = budgetHours;
    this.status = status != null ? status : this.status;
  }

  /** Links the project to one of the owner's clients; {@code null} unlinks it. */
  public void assignClient(UUID clientId) {
    this.clientId = clientId;
  }

  public void touch(Instant at) {
    this.updatedAt = at;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public UUID getClientId() {
    return clientId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getTrelloBoardId() {
    return trelloBoardId;
  }

  public String getColor() {
    return color;
  }

  public BigDecimal getHourlyRate() {
    return hourlyRate;
  }

  public boolean isBillableByDefault() {
    return billableByDefault;
  }

  public Double getBudgetHours() {
    return budgetHours;
  }

  public ProjectStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
