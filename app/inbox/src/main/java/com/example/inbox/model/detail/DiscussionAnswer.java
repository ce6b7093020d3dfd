package com.example.inbox.model.detail;

import java.time.Instant;
import java.util.List;

public record DiscussionAnswer(
    String author,
    boolean isAnswer,
    int upvotes,
    String body,
    Instant createdAt,
    List<DiscussionReply> replies) {

  public DiscussionAnswer {
    replies = replies == null ? List.of() : List.copyOf(replies);
  }
}
