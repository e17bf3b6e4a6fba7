package io.timezz.backend.auth;

import io.timezz.backend.security.SessionTokenService;
import io.timezz.backend.security.SessionTokenService.IssuedToken;
import io.timezz.backend.user.User;
import io.timezz.backend.user.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Exchanges a Trello member identity for a TimeZZ session token. */
@Service
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  private final UserService userService;
  private final SessionTokenService sessionTokenService;

  public AuthService(UserService userService, SessionTokenService sessionTokenService) {
    this.userService = userService;
    this.sessionTokenService = sessionTokenService;
  }

  public record LoginResult(IssuedToken token, User user) {}

  public LoginResult login(String trelloUserId, String email, String name, String avatarUrl) {
    var user = userService.findOrCreateByTrelloId(trelloUserId, email, name, avatarUrl);
    user = userService.recordLogin(user.getId(), email, name, avatarUrl);
    var token = sessionTokenService.issue(user.getTrelloId());
    log.info("User {} logged in", user.getId());
    return new LoginResult(token, user);
  }
}
