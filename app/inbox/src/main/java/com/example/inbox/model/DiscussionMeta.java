/*
 * どこで: Inbox ドメインモデル
 * 何を: Discussion 通知の解決結果を保持する
 * なぜ: GraphQL 検索で見つけた番号と回答状態を一覧に出すため
 */
package com.example.inbox.model;

import java.util.OptionalLong;

public record DiscussionMeta(
    RepoMeta repo, String title, long number, DiscussionState state, String htmlUrl)
    implements NotificationTarget {

  @Override
  public TargetKind kind() {
    return TargetKind.DISCUSSION;
  }

  @Override
  public OptionalLong numberIfPresent() {
    return OptionalLong.of(number);
  }
}
