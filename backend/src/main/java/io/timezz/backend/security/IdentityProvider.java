package io.timezz.backend.security;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the caller of a request to a user id. Exactly one implementation is active, chosen by
 * {@code timezz.security.mode}.
 */
public interface IdentityProvider {

  /**
   * @return the caller's user id, or empty when the request carries no usable identity
   */
  Optional<UUID> resolveUserId(HttpServletRequest request);
}
