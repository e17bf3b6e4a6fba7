package io.timezz.backend.user;

public enum SubscriptionTier {
  FREE,
  PRO,
  ENTERPRISE;

  public boolean isLimited() {
    return this == FREE;
  }
}
