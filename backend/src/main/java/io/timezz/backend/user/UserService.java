package io.timezz.backend.user;

import io.timezz.backend.exception.InvalidStateException;
import io.timezz.backend.exception.ResourceNotFoundException;
import io.timezz.backend.timeentry.BillingCalculator;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);
  private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

  private final UserRepository userRepository;
  private final Clock clock;

  public UserService(UserRepository userRepository, Clock clock) {
    this.userRepository = userRepository;
    this.clock = clock;
  }

  /**
   * Returns the user registered for the given Trello id, creating it on first sight. Concurrent
   * first requests of the same identity race on the unique {@code trello_id}; the loser re-reads
   * the winner's row.
   */
  public User findOrCreateByTrelloId(String trelloId, String email, String name, String avatarUrl) {
    if (trelloId == null || trelloId.isBlank()) {
      throw new InvalidStateException("Missing identity", "Trello user id is required");
    }
    return userRepository
        .findByTrelloId(trelloId)
        .orElseGet(() -> lazyCreateUser(trelloId, email, name, avatarUrl));
  }

  @Transactional
  public User recordLogin(UUID userId, String email, String name, String avatarUrl) {
    var user = getUser(userId);
    user.updateProfile(email, name, avatarUrl);
    user.markActive(clock.instant());
    return userRepository.save(user);
  }

  @Transactional(readOnly = true)
  public User getUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  @Transactional
  public User updateBilling(
      UUID userId, BigDecimal hourlyRate, String currency, String companyName) {
    BillingCalculator.requireValidRate(hourlyRate);
    var user = getUser(userId);
    String normalizedCurrency =
        currency == null ? user.getCurrency() : currency.trim().toUpperCase(Locale.ROOT);
    if (!CURRENCY_CODE.matcher(normalizedCurrency).matches()) {
      throw new InvalidStateException(
          "Invalid currency", "Currency must be a 3-letter ISO 4217 code");
    }
    user.updateBilling(
        BillingCalculator.snapshotRate(hourlyRate), normalizedCurrency, companyName);
    user = userRepository.save(user);
    log.info(
        "Updated billing defaults for user {}: rate={} {}", userId, hourlyRate, normalizedCurrency);
    return user;
  }

  private User lazyCreateUser(String trelloId, String email, String name, String avatarUrl) {
    try {
      var user =
          userRepository.saveAndFlush(
              new User(trelloId, email, name, avatarUrl, clock.instant()));
      log.info("Created user {} for Trello id {}", user.getId(), trelloId);
      return user;
    } catch (DataIntegrityViolationException e) {
      // Race condition: a concurrent request already created this user
      return userRepository
          .findByTrelloId(trelloId)
          .orElseThrow(
              () ->
                  new IllegalStateException(
                      "User not found after constraint violation for: " + trelloId));
    }
  }
}
