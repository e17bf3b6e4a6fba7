package io.timezz.backend.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Logs authentication failures before delegating to {@link BearerTokenAuthenticationEntryPoint}
 * for the 401 response and its {@code WWW-Authenticate} challenge.
 */
@Component
public class LoggingAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(LoggingAuthenticationEntryPoint.class);

  private final BearerTokenAuthenticationEntryPoint delegate;

  public LoggingAuthenticationEntryPoint() {
    this.delegate = new BearerTokenAuthenticationEntryPoint();
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException) {
    String authorization = request.getHeader("Authorization");
    boolean bearerPresented = authorization != null && authorization.startsWith("Bearer ");
    log.warn(
        "Rejected unauthenticated {} {} (bearer={}): {}",
        request.getMethod(),
        request.getRequestURI(),
        bearerPresented,
        authException.getMessage());

    delegate.commence(request, response, authException);
  }
}
