package io.timezz.backend.auth;

import io.timezz.backend.user.UserController.UserResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

  private final AuthService authService;

  public AuthController(AuthService authService) {
    this.authService = authService;
  }

  @PostMapping("/login")
  public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
    var result =
        authService.login(
            request.trelloUserId(), request.email(), request.name(), request.avatarUrl());
    return ResponseEntity.ok(
        new LoginResponse(
            result.token().accessToken(),
            "bearer",
            result.token().expiresAt(),
            UserResponse.from(result.user())));
  }

  public record LoginRequest(
      @NotBlank(message = "trelloUserId is required") @Size(max = 255) String trelloUserId,
      @Size(max = 255) String email,
      @Size(max = 255) String name,
      @Size(max = 1000) String avatarUrl) {}

  public record LoginResponse(
      String accessToken, String tokenType, Instant expiresAt, UserResponse user) {}
}
