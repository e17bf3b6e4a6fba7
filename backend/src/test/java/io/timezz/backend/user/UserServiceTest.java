package io.timezz.backend.user;

import static io.timezz.backend.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.timezz.backend.MutableClock;
import io.timezz.backend.exception.InvalidStateException;
import io.timezz.backend.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-05T10:00:00Z");

  @Mock private UserRepository userRepository;

  private UserService service;

  @BeforeEach
  void setUp() {
    service = new UserService(userRepository, new MutableClock(NOW));
  }

  @Test
  void findOrCreate_returnsExistingUser() {
    var existing = withId(new User("trello-1", null, "Ann", null, NOW), UUID.randomUUID());
    when(userRepository.findByTrelloId("trello-1")).thenReturn(Optional.of(existing));

    var user = service.findOrCreateByTrelloId("trello-1", null, "Ann", null);

    assertThat(user).isSameAs(existing);
    verify(userRepository, never()).saveAndFlush(any());
  }

  @Test
  void findOrCreate_stampsCreationFromClock() {
    when(userRepository.findByTrelloId("trello-2")).thenReturn(Optional.empty());
    when(userRepository.saveAndFlush(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

    var user = service.findOrCreateByTrelloId("trello-2", null, "Bea", null);

    assertThat(user.getCreatedAt()).isEqualTo(NOW);
    assertThat(user.getLastActiveAt()).isEqualTo(NOW);
  }

  @Test
  void findOrCreate_rereadsAfterConcurrentInsert() {
    var winner = withId(new User("trello-1", null, "Ann", null, NOW), UUID.randomUUID());
    when(userRepository.findByTrelloId("trello-1"))
        .thenReturn(Optional.empty())
        .thenReturn(Optional.of(winner));
    when(userRepository.saveAndFlush(any(User.class)))
        .thenThrow(new DataIntegrityViolationException("duplicate key"));

    var user = service.findOrCreateByTrelloId("trello-1", null, "Ann", null);

    assertThat(user).isSameAs(winner);
  }

  @Test
  void findOrCreate_requiresTrelloId() {
    assertThatThrownBy(() -> service.findOrCreateByTrelloId(" ", null, null, null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void recordLogin_refreshesProfileAndActivity() {
    var userId = UUID.randomUUID();
    var user = withId(new User("trello-1", null, "Ann", null, NOW), userId);
    when(userRepository.findById(userId)).thenReturn(Optional.of(user));
    when(userRepository.save(user)).thenReturn(user);

    var result = service.recordLogin(userId, "ann@example.com", "Ann B", null);

    assertThat(result.getEmail()).isEqualTo("ann@example.com");
    assertThat(result.getName()).isEqualTo("Ann B");
    assertThat(result.getLastActiveAt()).isEqualTo(NOW);
  }

  @Test
  void updateBilling_normalizesCurrency() {
    var userId = UUID.randomUUID();
    var user = withId(new User("trello-1", null, "Ann", null, NOW), userId);
    when(userRepository.findById(userId)).thenReturn(Optional.of(user));
    when(userRepository.save(user)).thenReturn(user);

    var result = service.updateBilling(userId, new BigDecimal("75.00"), " eur ", "Ann Ltd");

    assertThat(result.getHourlyRate()).isEqualByComparingTo("75.00");
    assertThat(result.getCurrency()).isEqualTo("EUR");
    assertThat(result.getCompanyName()).isEqualTo("Ann Ltd");
  }

  @Test
  void updateBilling_rejectsInvalidInput() {
    var userId = UUID.randomUUID();
    var user = withId(new User("trello-1", null, "Ann", null, NOW), userId);
    when(userRepository.findById(userId)).thenReturn(Optional.of(user));

    assertThatThrownBy(() -> service.updateBilling(userId, BigDecimal.ONE, "EURO", null))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.updateBilling(userId, new BigDecimal("-5"), "EUR", null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void updateBilling_rejectsRateAboveMaximumAndRoundsToCents() {
    var userId = UUID.randomUUID();
    var user = withId(new User("trello-1", null, "Ann", null, NOW), userId);
    when(userRepository.findById(userId)).thenReturn(Optional.of(user));
    when(userRepository.save(user)).thenReturn(user);

    assertThatThrownBy(
            () -> service.updateBilling(userId, new BigDecimal("1000000000000"), "EUR", null))
        .isInstanceOf(InvalidStateException.class);

    var result = service.updateBilling(userId, new BigDecimal("42.125"), "EUR", null);
    assertThat(result.getHourlyRate()).isEqualTo(new BigDecimal("42.13"));
  }

  @Test
  void getUser_throwsWhenMissing() {
    var userId = UUID.randomUUID();
    when(userRepository.findById(userId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getUser(userId))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
