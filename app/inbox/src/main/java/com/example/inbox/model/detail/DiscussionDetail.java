/*
 * どこで: Inbox 詳細ビュー
 * 何を: Discussion の本文、投票数、回答一覧をまとめて保持する
 * なぜ: 回答とその返信を入れ子のまま詳細画面に渡すため
 */
package com.example.inbox.model.detail;

import com.example.inbox.model.DiscussionMeta;
import com.example.inbox.model.TargetKind;
import java.time.Instant;
import java.util.List;

public record DiscussionDetail(
    DiscussionMeta meta,
    String author,
    int upvotes,
    String body,
    Instant createdAt,
    List<DiscussionAnswer> answers)
    implements ItemDetail {

  public DiscussionDetail {
    answers = answers == null ? List.of() : List.copyOf(answers);
  }

  @Override
  public TargetKind kind() {
    return TargetKind.DISCUSSION;
  }
}
