/*
 * どこで: Inbox ドメインモデル
 * 何を: 通知 API の subject (種別、タイトル、詳細 URL) を保持する
 * なぜ: URL が無い種別でも null を意識せず扱えるようにするため
 */
package com.example.inbox.model;

import java.util.Optional;

/**
 * 通知の対象。{@code detailUrl} は Discussion や CheckSuite では存在しない。
 */
public record NotificationSubject(
    String type, String title, String detailUrl, String latestCommentUrl) {

  public NotificationSubject {
    type = type == null ? "" : type;
    title = title == null ? "" : title;
  }

  public Optional<String> detailUrlIfPresent() {
    return detailUrl == null || detailUrl.isBlank() ? Optional.empty() : Optional.of(detailUrl);
  }

  public Optional<String> latestCommentUrlIfPresent() {
    return latestCommentUrl == null || latestCommentUrl.isBlank()
        ? Optional.empty()
        : Optional.of(latestCommentUrl);
  }
}
