/*
 * どこで: Inbox ドメインモデル
 * 何を: Pull Request 通知の解決結果を保持する
 * なぜ: マージ済みかどうかを一覧で区別するため
 */
package com.example.inbox.model;

import java.time.Instant;
import java.util.OptionalLong;

public record PullRequestMeta(
    RepoMeta repo,
    String title,
    String body,
    long number,
    String author,
    PullRequestState state,
    Instant createdAt,
    String htmlUrl)
    implements NotificationTarget {

  @Override
  public TargetKind kind() {
    return TargetKind.PULL_REQUEST;
  }

  @Override
  public OptionalLong numberIfPresent() {
    return OptionalLong.of(number);
  }
}
