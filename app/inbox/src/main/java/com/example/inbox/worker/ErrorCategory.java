/*
 * どこで: Inbox ワーカー
 * 何を: UI に返すエラーの分類を表す
 * なぜ: 表示文言と再試行の判断を分類ごとに決めるため
 */
package com.example.inbox.worker;

public enum ErrorCategory {
  AUTHENTICATION,
  RATE_LIMITED,
  FETCH,
  RESOLVE,
  HYDRATION,
  TASK_AGGREGATION,
  NO_BROWSABLE_URL,
  NO_DETAIL,
  UNEXPECTED
}
