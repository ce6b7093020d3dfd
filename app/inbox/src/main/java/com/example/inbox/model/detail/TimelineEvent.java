/*
 * どこで: Inbox 詳細ビュー
 * 何を: Issue / Pull Request のタイムライン項目を保持する
 * なぜ: イベント種別ごとに型を増やさず属性で表すため
 */
package com.example.inbox.model.detail;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * タイムラインの 1 項目。種別固有の値 (label, assignee, body など) は attributes に入る。
 *
 * <p>actor と createdAt は subscribed/mentioned のような匿名イベントでは null。
 */
public record TimelineEvent(
    EventKind kind, String actor, Instant createdAt, Map<String, String> attributes) {

  public TimelineEvent {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public Optional<String> attribute(String key) {
    return Optional.ofNullable(attributes.get(key));
  }
}
