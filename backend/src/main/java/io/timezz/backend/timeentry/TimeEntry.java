package io.timezz.backend.timeentry;

import io.timezz.backend.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One interval of tracked work on a Trello card. An entry is open while {@code endTime} is null;
 * duration, rate snapshot and amount are only populated once it is closed.
 */
@Entity
@Table(name = "time_entries")
public class TimeEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "project_id")
  private UUID projectId;

  @Column(name = "card_id", nullable = false, length = 255)
  private String cardId;

  @Column(name = "card_name", nullable = false, length = 500)
  private String cardName;

  @Column(name = "board_id", length = 255)
  private String boardId;

  @Column(name = "list_name", length = 255)
  private String listName;

  @Column(name = "start_time", nullable = false, updatable = false)
  private Instant startTime;

  @Column(name = "end_time")
  private Instant endTime;

  @Column(name = "duration_minutes")
  private Double durationMinutes;

  @Column(name = "hourly_rate", precision = 12, scale = 2)
  private BigDecimal hourlyRate;

  @Column(name = "currency", length = 3)
  private String currency;

  @Column(name = "amount", precision = 12, scale = 2)
  private BigDecimal amount;

  @Column(name = "manual", nullable = false)
  private boolean manual;

  @Column(name = "billable", nullable = false)
  private boolean billable;

  @Column(name = "billed", nullable = false)
  private boolean billed;

  @Column(name = "invoice_reference", length = 255)
  private String invoiceReference;

  @Column(name = "billed_at")
  private Instant billedAt;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tags", columnDefinition = "jsonb", nullable = false)
  private List<String> tags;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TimeEntry() {}

  public TimeEntry(
      UUID userId,
      TimeEntrySubject subject,
      UUID projectId,
      Instant startTime,
      String description,
      List<String> tags,
      boolean billable,
      boolean manual,
      Instant createdAt) {
    this.userId = userId;
    this.cardId = subject.cardId();
    this.cardName = subject.cardName();
    this.boardId = subject.boardId();
    this.listName = subject.listName();
    this.projectId = projectId;
    this.startTime = startTime;
    this.description = description;
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    this.billable = billable;
    this.manual = manual;
    this.billed = false;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public boolean isOpen() {
    return endTime == null;
  }

  /**
   * Closes the entry at {@code end}, snapshotting the resolved rate and currency. The rate is never
   * re-resolved afterwards.
   *
   * @throws InvalidStateException if the entry is already closed or {@code end} is not after start
   */
  public void close(Instant end, BigDecimal rate, String currency) {
    if (!isOpen()) {
      throw new InvalidStateException("Entry already closed", "Time entry " + id + " is closed");
    }
    if (!end.isAfter(startTime)) {
      throw new InvalidStateException("Invalid range", "End time must be after start time");
    }
    double minutes = BillingCalculator.durationMinutes(startTime, end);
    BigDecimal snapshot = BillingCalculator.snapshotRate(rate);
    BigDecimal closedAmount = BillingCalculator.amount(minutes, snapshot, billable);
    this.endTime = end;
    this.durationMinutes = minutes;
    this.hourlyRate = snapshot;
    this.currency = currency;
    this.amount = closedAmount;
  }

  /**
   * Replaces the duration of a closed entry, moving the end time and recomputing the amount. The
   * end time has millisecond precision, so the stored duration is the rounded one.
   *
   * @throws InvalidStateException if the duration is not positive, rounds to zero milliseconds or
   *     exceeds {@link BillingCalculator#MAX_ENTRY_MINUTES}
   */
  public void applyDuration(double minutes) {
    if (minutes <= 0 || Double.isNaN(minutes) || Double.isInfinite(minutes)) {
      throw new InvalidStateException("Invalid duration", "Duration must be a positive number");
    }
    if (minutes > BillingCalculator.MAX_ENTRY_MINUTES) {
      throw new InvalidStateException(
          "Invalid duration",
          "Duration must not exceed " + (long) BillingCalculator.MAX_ENTRY_MINUTES + " minutes");
    }
    long millis = Math.round(minutes * 60_000);
    if (millis < 1) {
      throw new InvalidStateException(
          "Invalid duration", "Duration must be at least one millisecond");
    }
    Instant end = startTime.plusMillis(millis);
    double rounded = BillingCalculator.durationMinutes(startTime, end);
    BigDecimal newAmount = BillingCalculator.amount(rounded, hourlyRate, billable);
    this.endTime = end;
    this.durationMinutes = rounded;
    this.amount = newAmount;
  }

  public void changeBillable(boolean billable) {
    this.billable = billable;
    if (!isOpen()) {
      this.amount = BillingCalculator.amount(durationMinutes, hourlyRate, billable);
    }
  }

  public void updateNotes(String description, List<String> tags) {
    if (description != null) {
      this.description = description;
    }
    if (tags != null) {
      this.tags = new ArrayList<>(tags);
    }
  }

  public void markBilled(String invoiceReference, Instant billedAt) {
    this.billed = true;
    this.invoiceReference = invoiceReference;
    this.billedAt = billedAt;
  }

  public void touch(Instant at) {
    this.updatedAt = at;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getCardId() {
    return cardId;
  }

  public String getCardName() {
    return cardName;
  }

  public String getBoardId() {
    return boardId;
  }

  public String getListName() {
    return listName;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Instant getEndTime() {
    return endTime;
  }

  public Double getDurationMinutes() {
    return durationMinutes;
  }

  public BigDecimal getHourlyRate() {
    return hourlyRate;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public boolean isManual() {
    return manual;
  }

  public boolean isBillable() {
    return billable;
  }

  public boolean isBilled() {
    return billed;
  }

  public String getInvoiceReference() {
    return invoiceReference;
  }

  public Instant getBilledAt() {
    return billedAt;
  }

  public String getDescription() {
    return description;
  }

  public List<String> getTags() {
    return tags;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
