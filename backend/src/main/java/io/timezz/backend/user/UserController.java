package io.timezz.backend.user;

import io.timezz.backend.security.UserContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

  private final UserService userService;

  public UserController(UserService userService) {
    this.userService = userService;
  }

  @GetMapping("/me")
  public ResponseEntity<UserResponse> me() {
    return ResponseEntity.ok(UserResponse.from(userService.getUser(UserContext.requireUserId())));
  }

  @PutMapping("/me/billing")
  public ResponseEntity<UserResponse> updateBilling(
      @Valid @RequestBody UpdateBillingRequest request) {
    var user =
        userService.updateBilling(
            UserContext.requireUserId(),
            request.hourlyRate(),
            request.currency(),
            request.companyName());
    return ResponseEntity.ok(UserResponse.from(user));
  }

  public record UpdateBillingRequest(
      @PositiveOrZero(message = "hourlyRate must not be negative")
          @DecimalMax(value = "100000.00", message = "hourlyRate must not exceed 100000.00")
          @Digits(integer = 6, fraction = 2, message = "hourlyRate has at most 2 decimals")
          BigDecimal hourlyRate,
      @Pattern(regexp = "^[A-Za-z]{3}$", message = "currency must be a 3-letter ISO 4217 code")
          String currency,
      @Size(max = 255) String companyName) {}

  public record UserResponse(
      UUID id,
      String trelloId,
      String email,
      String name,
      String avatarUrl,
      BigDecimal hourlyRate,
      String currency,
      String companyName,
      SubscriptionTier subscriptionTier,
      Instant createdAt,
      Instant lastActiveAt) {

    public static UserResponse from(User user) {
      return new UserResponse(
          user.getId(),
          user.getTrelloId(),
          user.getEmail(),
          user.getName(),
          user.getAvatarUrl(),
          user.getHourlyRate(),
          user.getCurrency(),
          user.getCompanyName(),
          user.getSubscriptionTier(),
          user.getCreatedAt(),
          user.getLastActiveAt());
    }
  }
}
