package io.timezz.backend.client;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** A customer the user bills. Projects optionally belong to one client of the same owner. */
@Entity
@Table(name = "clients")
public class Client {

  public static final String DEFAULT_COLOR = "#0079bf";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private UUID ownerId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "company", length = 255)
  private String company;

  @Column(name = "hourly_rate", precision = 12, scale = 2)
  private BigDecimal hourlyRate;

  @Column(name = "address", columnDefinition = "TEXT")
  private String address;

  @Column(name = "phone", length = 50)
  private String phone;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "color", nullable = false, length = 7)
  private String color;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Client() {}

  public Client(UUID ownerId, String name, Instant createdAt) {
    this.ownerId = ownerId;
    this.name = name;
    this.color = DEFAULT_COLOR;
    this.active = true;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public void update(
      String name,
      String email,
      String company,
      BigDecimal hourlyRate,
      String address,
      String phone,
      String notes,
      String color) {
    this.name = name;
    this.email = email;
    this.company = company;
    this.hourlyRate = hourlyRate;
    this.address = address;
    this.phone = phone;
    this.notes = notes;
    this.color = color != null ? color : DEFAULT_COLOR;
  }

  public void changeActive(boolean active) {
    this.active = active;
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

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public String getCompany() {
    return company;
  }

  public BigDecimal getHourlyRate() {
    return hourlyRate;
  }

  public String getAddress() {
    return address;
  }

  public String getPhone() {
    return phone;
  }

  public String getNotes() {
    return notes;
  }

  public String getColor() {
    return color;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
