/*
 * どこで: Inbox ドメインモデル
 * 何を: 解決済みの通知対象を種別ごとに表す共通型
 * なぜ: 一覧表示やブラウザ URL 解決を種別に関係なく書けるようにするため
 */
package com.example.inbox.model;

import java.util.OptionalLong;

/**
 * 通知対象の種別ごとの型。実装は {@link IssueMeta}, {@link PullRequestMeta}, {@link ReleaseMeta},
 * {@link DiscussionMeta}, {@link CiBuildTarget}, {@link UnknownTarget} に限る。
 */
public interface NotificationTarget {

  TargetKind kind();

  default OptionalLong numberIfPresent() {
    return OptionalLong.empty();
  }
}
