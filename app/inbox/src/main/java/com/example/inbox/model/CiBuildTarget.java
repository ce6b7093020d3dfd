package com.example.inbox.model;

public record CiBuildTarget() implements NotificationTarget {

  public static final CiBuildTarget INSTANCE = new CiBuildTarget();

  @Override
  public TargetKind kind() {
    return TargetKind.CI_BUILD;
  }
}
