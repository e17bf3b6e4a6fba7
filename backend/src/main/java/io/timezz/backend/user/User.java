package io.timezz.backend.user;

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
@Table(name = "users")
public class User {

  public static final String DEFAULT_CURRENCY = "USD";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "trello_id", nullable = false, unique = true, length = 255)
  private String trelloId;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "name", length = 255)
  private String name;

  @Column(name = "avatar_url", length = 1000)
  private String avatarUrl;

  @Column(name = "hourly_rate", precision = 12, scale = 2)
  private BigDecimal hourlyRate;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "company_name", length = 255)
  private String companyName;

  @Enumerated(EnumType.STRING)
  @Column(name = "subscription_tier", nullable = false, length = 20)
  private SubscriptionTier subscriptionTier;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "last_active_at")
  private Instant lastActiveAt;

  protected User() {}

  public User(
      String trelloId, String email, String name, String avatarUrl, Instant createdAt) {
    this.trelloId = trelloId;
    this.email = email;
    this.name = name;
    this.avatarUrl = avatarUrl;
    this.currency = DEFAULT_CURRENCY;
    this.subscriptionTier = SubscriptionTier.FREE;
    this.createdAt = createdAt;
    this.lastActiveAt = this.createdAt;
  }

  public UUID getId() {
    return id;
  }

  public String getTrelloId() {
    return trelloId;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public String getAvatarUrl() {
    return avatarUrl;
  }

  public BigDecimal getHourlyRate() {
    return hourlyRate;
  }

  public String getCurrency() {
    return currency;
  }

  public String getCompanyName() {
    return companyName;
  }

  public SubscriptionTier getSubscriptionTier() {
    return subscriptionTier;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastActiveAt() {
    return lastActiveAt;
  }

  /** Applies non-null profile fields supplied by the identity provider. */
  public void updateProfile(String email, String name, String avatarUrl) {
    if (email != null) {
      this.email = email;
    }
    if (name != null) {
      this.name = name;
    }
    if (avatarUrl != null) {
      this.avatarUrl = avatarUrl;
    }
  }

  public void updateBilling(BigDecimal hourlyRate, String currency, String companyName) {
    this.hourlyRate = hourlyRate;
    this.currency = currency;
    this.companyName = companyName;
  }

  public void changeTier(SubscriptionTier subscriptionTier) {
    this.subscriptionTier = subscriptionTier;
  }

  public void markActive(Instant at) {
    this.lastActiveAt = at;
  }
}
