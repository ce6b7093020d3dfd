/*
 * どこで: Inbox ドメインモデル
 * 何を: 一覧 API から得た未加工の通知スレッドを表現する
 * なぜ: hydration の入力を不変な値として扱うため
 */
package com.example.inbox.model;

import java.time.Instant;
import java.util.Objects;

public record NotificationStub(
    String id,
    boolean unread,
    NotificationSubject subject,
    RepoMeta repository,
    Instant lastUpdatedAt) {

  public NotificationStub {
    Objects.requireNonNull(id, "id is required");
    Objects.requireNonNull(subject, "subject is required");
    repository = repository == null ? new RepoMeta("", "") : repository;
    lastUpdatedAt = lastUpdatedAt == null ? Instant.EPOCH : lastUpdatedAt;
  }
}
