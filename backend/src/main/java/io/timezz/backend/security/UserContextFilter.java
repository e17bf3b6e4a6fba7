package io.timezz.backend.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Binds the caller's user id to {@link UserContext} for the duration of the request. */
@Component
public class UserContextFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(UserContextFilter.class);

  private final IdentityProvider identityProvider;

  public UserContextFilter(IdentityProvider identityProvider) {
    this.identityProvider = identityProvider;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      resolve(request).ifPresent(UserContext::setCurrentUserId);
      filterChain.doFilter(request, response);
    } finally {
      UserContext.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/actuator/") || path.startsWith("/api/v1/auth/");
  }

  private Optional<UUID> resolve(HttpServletRequest request) {
    try {
      return identityProvider.resolveUserId(request);
    } catch (DataAccessException e) {
      log.warn(
          "Failed to resolve user for {} {}: {}",
          request.getMethod(),
          request.getRequestURI(),
          e.getMessage());
      return Optional.empty();
    }
  }
}
