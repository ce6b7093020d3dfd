/*
 * どこで: Inbox ドメインモデル
 * 何を: hydration 済みの通知 (stub + 対象) を表現する
 * なぜ: 同期ごとに target が変わっても同一性を stub id だけで判定するため
 */
package com.example.inbox.model;

import java.util.Objects;

public record Notification(NotificationStub stub, NotificationTarget target) {

  public Notification {
    Objects.requireNonNull(stub, "stub is required");
    target = target == null ? UnknownTarget.INSTANCE : target;
  }

  public String id() {
    return stub.id();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Notification notification)) {
      return false;
    }
    return stub.id().equals(notification.stub.id());
  }

  @Override
  public int hashCode() {
    return stub.id().hashCode();
  }
}
