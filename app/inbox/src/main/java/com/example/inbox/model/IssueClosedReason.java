/*
 * どこで: Inbox ドメインモデル
 * 何を: Issue がクローズされた理由を表す
 * なぜ: state_reason の値を完了か見送りかの 2 択にまとめるため
 */
package com.example.inbox.model;

public enum IssueClosedReason {
  // 修正済み・解決済みなど
  COMPLETED,
  // wontfix, duplicate, stale など
  NOT_PLANNED;

  public static IssueClosedReason fromStateReason(String stateReason) {
    return "completed".equals(stateReason) ? COMPLETED : NOT_PLANNED;
  }
}
