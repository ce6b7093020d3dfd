/*
 * どこで: Inbox 詳細ビュー
 * 何を: Issue のメタ情報とタイムラインをまとめて保持する
 * なぜ: 詳細画面を 1 回のロードで描画するため
 */
package com.example.inbox.model.detail;

import com.example.inbox.model.IssueMeta;
import com.example.inbox.model.TargetKind;
import java.util.List;

public record IssueDetail(IssueMeta meta, List<TimelineEvent> events) implements ItemDetail {

  public IssueDetail {
    events = events == null ? List.of() : List.copyOf(events);
  }

  @Override
  public TargetKind kind() {
    return TargetKind.ISSUE;
  }
}
