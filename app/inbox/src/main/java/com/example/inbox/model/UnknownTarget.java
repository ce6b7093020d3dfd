package com.example.inbox.model;

public record UnknownTarget() implements NotificationTarget {

  public static final UnknownTarget INSTANCE = new UnknownTarget();

  @Override
  public TargetKind kind() {
    return TargetKind.UNKNOWN;
  }
}
