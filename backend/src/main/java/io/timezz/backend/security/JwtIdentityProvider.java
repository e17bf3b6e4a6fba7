package io.timezz.backend.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.timezz.backend.user.UserService;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Maps the subject of an already-validated bearer token to a user, creating the user on first
 * sight.
 */
@Component
@ConditionalOnProperty(name = "timezz.security.mode", havingValue = "jwt", matchIfMissing = true)
public class JwtIdentityProvider implements IdentityProvider {

  private final UserService userService;
  private final Cache<String, UUID> userCache =
      Caffeine.newBuilder().maximumSize(50_000).expireAfterWrite(Duration.ofHours(1)).build();

  public JwtIdentityProvider(UserService userService) {
    this.userService = userService;
  }

  @Override
  public Optional<UUID> resolveUserId(HttpServletRequest request) {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return Optional.empty();
    }
    Jwt jwt = jwtAuth.getToken();
    String trelloId = jwt.getSubject();
    if (trelloId == null || trelloId.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(
        userCache.get(
            trelloId,
            k ->
                userService
                    .findOrCreateByTrelloId(
                        k, jwt.getClaimAsString("email"), jwt.getClaimAsString("name"), null)
                    .getId()));
  }
}
