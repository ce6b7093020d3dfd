/*
 * どこで: Inbox 詳細ビュー
 * 何を: タイムライン項目の種別を表す
 * なぜ: GraphQL の __typename を表示用の種別にまとめるため
 */
package com.example.inbox.model.detail;

import java.util.HashMap;
import java.util.Map;

/** タイムライン項目の種別。GraphQL の __typename から引く。 */
public enum EventKind {
  COMMENTED("IssueComment"),
  CLOSED("ClosedEvent"),
  REOPENED("ReopenedEvent"),
  MERGED("MergedEvent"),
  LABELED("LabeledEvent"),
  UNLABELED("UnlabeledEvent"),
  ASSIGNED("AssignedEvent"),
  UNASSIGNED("UnassignedEvent"),
  RENAMED("RenamedTitleEvent"),
  CROSS_REFERENCED("CrossReferencedEvent"),
  REFERENCED("ReferencedEvent"),
  CONNECTED("ConnectedEvent"),
  REVIEWED("PullRequestReview"),
  REVIEW_REQUESTED("ReviewRequestedEvent"),
  COMMITTED("PullRequestCommit"),
  HEAD_REF_DELETED("HeadRefDeletedEvent"),
  HEAD_REF_FORCE_PUSHED("HeadRefForcePushedEvent"),
  MARKED_AS_DRAFT("ConvertToDraftEvent"),
  MARKED_AS_READY_FOR_REVIEW("ReadyForReviewEvent"),
  LOCKED("LockedEvent"),
  UNLOCKED("UnlockedEvent"),
  MILESTONED("MilestonedEvent"),
  PINNED("PinnedEvent"),
  UNPINNED("UnpinnedEvent"),
  MARKED_AS_DUPLICATE("MarkedAsDuplicateEvent"),
  UNMARKED_AS_DUPLICATE("UnmarkedAsDuplicateEvent"),
  SUBSCRIBED("SubscribedEvent"),
  MENTIONED("MentionedEvent"),
  UNKNOWN("");

  private static final Map<String, EventKind> BY_TYPENAME = indexByTypename();

  private final String typename;

  EventKind(String typename) {
    this.typename = typename;
  }

  public String typename() {
    return typename;
  }

  public static EventKind fromTypename(String typename) {
    if (typename == null) {
      return UNKNOWN;
    }
    return BY_TYPENAME.getOrDefault(typename, UNKNOWN);
  }

  private static Map<String, EventKind> indexByTypename() {
    final Map<String, EventKind> index = new HashMap<>();
    for (EventKind kind : values()) {
      if (kind != UNKNOWN) {
        index.put(kind.typename, kind);
      }
    }
    return Map.copyOf(index);
  }
}
