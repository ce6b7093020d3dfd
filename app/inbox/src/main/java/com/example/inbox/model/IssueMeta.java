/*
 * どこで: Inbox ドメインモデル
 * 何を: Issue 通知の解決結果 (タイトル、状態、作成者など) を保持する
 * なぜ: 一覧表示に必要な情報を詳細ロードなしで出すため
 */
package com.example.inbox.model;

import java.time.Instant;
import java.util.OptionalLong;

/** closedReason は state が CLOSED のときだけ非 null。 */
public record IssueMeta(
    RepoMeta repo,
    String title,
    String body,
    long number,
    String author,
    IssueState state,
    IssueClosedReason closedReason,
    Instant createdAt,
    String htmlUrl)
    implements NotificationTarget {

  public IssueMeta {
    closedReason = state == IssueState.CLOSED ? closedReason : null;
  }

  @Override
  public TargetKind kind() {
    return TargetKind.ISSUE;
  }

  @Override
  public OptionalLong numberIfPresent() {
    return OptionalLong.of(number);
  }
}
