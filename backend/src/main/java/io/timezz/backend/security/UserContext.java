package io.timezz.backend.security;

import java.util.UUID;

/** Holds the resolved user id for the request being processed on this thread. */
public final class UserContext {

  private static final ThreadLocal<UUID> CURRENT_USER_ID = new ThreadLocal<>();

  private UserContext() {}

  public static void setCurrentUserId(UUID userId) {
    CURRENT_USER_ID.set(userId);
  }

  public static UUID getCurrentUserId() {
    return CURRENT_USER_ID.get();
  }

  /**
   * @throws UserContextNotBoundException if no identity was resolved for this request
   */
  public static UUID requireUserId() {
    UUID userId = CURRENT_USER_ID.get();
    if (userId == null) {
      throw new UserContextNotBoundException();
    }
    return userId;
  }

  public static void clear() {
    CURRENT_USER_ID.remove();
  }
}
