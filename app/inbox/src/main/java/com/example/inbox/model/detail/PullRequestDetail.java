/*
 * どこで: Inbox 詳細ビュー
 * 何を: Pull Request のメタ情報とタイムラインをまとめて保持する
 * なぜ: 詳細画面を 1 回のロードで描画するため
 */
package com.example.inbox.model.detail;

import com.example.inbox.model.PullRequestMeta;
import com.example.inbox.model.TargetKind;
import java.util.List;

public record PullRequestDetail(PullRequestMeta meta, List<TimelineEvent> events)
    implements ItemDetail {

  public PullRequestDetail {
    events = events == null ? List.of() : List.copyOf(events);
  }

  @Override
  public TargetKind kind() {
    return TargetKind.PULL_REQUEST;
  }
}
