package io.timezz.backend.security;

import io.timezz.backend.config.TimezzProperties;
import io.timezz.backend.user.UserService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Resolves every request to the single configured demo user. Only active with {@code
 * timezz.security.mode=demo}; never enabled as a fallback of the JWT mode.
 */
@Component
@ConditionalOnProperty(name = "timezz.security.mode", havingValue = "demo")
public class DemoIdentityProvider implements IdentityProvider {

  private static final Logger log = LoggerFactory.getLogger(DemoIdentityProvider.class);

  private final UserService userService;
  private final TimezzProperties.Demo demo;
  private volatile UUID demoUserId;

  public DemoIdentityProvider(UserService userService, TimezzProperties properties) {
    this.userService = userService;
    this.demo = properties.demo();
    if (demo == null || demo.trelloId() == null || demo.trelloId().isBlank()) {
      throw new IllegalStateException("timezz.demo.trello-id is required in demo mode");
    }
  }

  @Override
  public Optional<UUID> resolveUserId(HttpServletRequest request) {
    UUID id = demoUserId;
    if (id == null) {
      id =
          userService
              .findOrCreateByTrelloId(demo.trelloId(), demo.email(), demo.name(), null)
              .getId();
      demoUserId = id;
      log.info("Demo identity bound to user {}", id);
    }
    return Optional.of(id);
  }
}
