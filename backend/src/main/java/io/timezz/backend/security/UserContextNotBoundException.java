package io.timezz.backend.security;

/** Thrown when a controller runs without a resolved user. Indicates a filter wiring bug. */
public class UserContextNotBoundException extends RuntimeException {

  public UserContextNotBoundException() {
    super("User context is not bound for this request");
  }
}
