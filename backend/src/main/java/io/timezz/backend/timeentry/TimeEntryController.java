package io.timezz.backend.timeentry;

import io.timezz.backend.security.UserContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/time")
public class TimeEntryController {

  private final TimerService timerService;

  public TimeEntryController(TimerService timerService) {
    this.timerService = timerService;
  }

  @GetMapping("/active")
  public ResponseEntity<ActiveTimerResponse> getActive() {
    var active = timerService.getActive(UserContext.requireUserId());
    return ResponseEntity.ok(
        active
            .map(
                timer ->
                    new ActiveTimerResponse(
                        true, TimeEntryResponse.from(timer.entry()), timer.elapsedMinutes()))
            .orElseGet(() -> new ActiveTimerResponse(false, null, null)));
  }

  @PostMapping("/start")
  public ResponseEntity<TimeEntryResponse> start(@Valid @RequestBody StartTimerRequest request) {
    var entry =
        timerService.start(
            UserContext.requireUserId(),
            new TimeEntrySubject(
                request.cardId(), request.cardName(), request.boardId(), request.listName()),
            request.projectId(),
            request.description(),
            request.tags(),
            request.billable());
    return ResponseEntity.created(URI.create("/api/v1/time/entries/" + entry.getId()))
        .body(TimeEntryResponse.from(entry));
  }

  @PostMapping("/stop")
  public ResponseEntity<StopTimerResponse> stop(
      @RequestParam(defaultValue = "false") boolean discard) {
    var entry = timerService.stop(UserContext.requireUserId(), discard);
    return ResponseEntity.ok(new StopTimerResponse(TimeEntryResponse.from(entry), discard));
  }

  @GetMapping("/entries")
  public ResponseEntity<Page<TimeEntryResponse>> listEntries(
      @RequestParam(required = false) UUID projectId,
      @RequestParam(required = false) String boardId,
      @RequestParam(required = false) String cardId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var entries =
        timerService.listEntries(
            UserContext.requireUserId(),
            new TimeEntryFilter(projectId, boardId, cardId, from, to),
            page,
            size);
    return ResponseEntity.ok(entries.map(TimeEntryResponse::from));
  }

  @PostMapping("/entries")
  public ResponseEntity<TimeEntryResponse> recordManual(
      @Valid @RequestBody ManualEntryRequest request) {
    var entry =
        timerService.recordManual(
            UserContext.requireUserId(),
            new TimeEntrySubject(
                request.cardId(), request.cardName(), request.boardId(), request.listName()),
            request.startTime(),
            request.endTime(),
            request.projectId(),
            request.hourlyRate(),
            request.billable(),
            request.description(),
            request.tags());
    return ResponseEntity.created(URI.create("/api/v1/time/entries/" + entry.getId()))
        .body(TimeEntryResponse.from(entry));
  }

  @PatchMapping("/entries/{id}")
  public ResponseEntity<TimeEntryResponse> editEntry(
      @PathVariable UUID id, @Valid @RequestBody UpdateTimeEntryRequest request) {
    var entry =
        timerService.editClosed(
            UserContext.requireUserId(),
            id,
            new TimeEntryPatch(
                request.description(),
                request.durationMinutes(),
                request.billable(),
                request.tags()));
    return ResponseEntity.ok(TimeEntryResponse.from(entry));
  }

  @DeleteMapping("/entries/{id}")
  public ResponseEntity<Void> deleteEntry(@PathVariable UUID id) {
    timerService.deleteClosed(UserContext.requireUserId(), id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/entries/billed")
  public ResponseEntity<List<TimeEntryResponse>> markBilled(
      @Valid @RequestBody MarkBilledRequest request) {
    var entries =
        timerService.markBilled(
            UserContext.requireUserId(), request.entryIds(), request.invoiceReference());
    return ResponseEntity.ok(entries.stream().map(TimeEntryResponse::from).toList());
  }

  // --- DTOs ---

  public record StartTimerRequest(
      @NotBlank(message = "cardId is required") @Size(max = 255) String cardId,
      @NotBlank(message = "cardName is required") @Size(max = 500) String cardName,
      @Size(max = 255) String boardId,
      @Size(max = 255) String listName,
      UUID projectId,
      String description,
      List<String> tags,
      Boolean billable) {}

  public record ManualEntryRequest(
      @NotBlank(message = "cardId is required") @Size(max = 255) String cardId,
      @NotBlank(message = "cardName is required") @Size(max = 500) String cardName,
      @Size(max = 255) String boardId,
      @Size(max = 255) String listName,
      @NotNull(message = "startTime is required") Instant startTime,
      @NotNull(message = "endTime is required") Instant endTime,
      UUID projectId,
      @PositiveOrZero(message = "hourlyRate must not be negative")
          @DecimalMax(value = "100000.00", message = "hourlyRate must not exceed 100000.00")
          @Digits(integer = 6, fraction = 2, message = "hourlyRate has at most 2 decimals")
          BigDecimal hourlyRate,
      Boolean billable,
      String description,
      List<String> tags) {}

  public record UpdateTimeEntryRequest(
      String description,
      @Positive(message = "durationMinutes must be positive")
          @DecimalMax(value = "527040", message = "durationMinutes must not exceed 527040")
          Double durationMinutes,
      Boolean billable,
      List<String> tags) {}

  public record MarkBilledRequest(
      @NotEmpty(message = "entryIds must not be empty") List<UUID> entryIds,
      @NotBlank(message = "invoiceReference is required") @Size(max = 255)
          String invoiceReference) {}

  public record ActiveTimerResponse(
      boolean active, TimeEntryResponse entry, Double elapsedMinutes) {}

  public record StopTimerResponse(TimeEntryResponse entry, boolean discarded) {}

  public record TimeEntryResponse(
      UUID id,
      UUID projectId,
      String cardId,
      String cardName,
      String boardId,
      String listName,
      Instant startTime,
      Instant endTime,
      Double durationMinutes,
      BigDecimal hourlyRate,
      String currency,
      BigDecimal amount,
      boolean manual,
      boolean billable,
      boolean billed,
      String invoiceReference,
      String description,
      List<String> tags,
      Instant createdAt,
      Instant updatedAt) {

    public static TimeEntryResponse from(TimeEntry entry) {
      return new TimeEntryResponse(
          entry.getId(),
          entry.getProjectId(),
          entry.getCardId(),
          entry.getCardName(),
          entry.getBoardId(),
          entry.getListName(),
          entry.getStartTime(),
          entry.getEndTime(),
          entry.getDurationMinutes(),
          entry.getHourlyRate(),
          entry.getCurrency(),
          entry.getAmount(),
          entry.isManual(),
          entry.isBillable(),
          entry.isBilled(),
          entry.getInvoiceReference(),
          entry.getDescription(),
          entry.getTags(),
          entry.getCreatedAt(),
          entry.getUpdatedAt());
    }
  }
}
