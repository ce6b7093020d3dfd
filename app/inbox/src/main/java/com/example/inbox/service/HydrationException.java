/*
 * どこで: Inbox サービス層
 * 何を: hydration バッチの失敗 (解決失敗/タスク異常終了) を集約して表現する
 * なぜ: 部分的な inbox を作らずに refresh 全体を中断するため
 */
package com.example.inbox.service;

import java.util.List;

public class HydrationException extends RuntimeException {

  public enum Reason {
    RESOLVE_FAILED,
    TASK_FAILED
  }

  private final Reason reason;
  private final List<String> failedStubIds;

  public HydrationException(
      Reason reason, String message, List<String> failedStubIds, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.failedStubIds = failedStubIds == null ? List.of() : List.copyOf(failedStubIds);
  }

  public Reason reason() {
    return reason;
  }

  public List<String> failedStubIds() {
    return failedStubIds;
  }
}
