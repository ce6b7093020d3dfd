/*
 * どこで: Inbox サービス層
 * 何を: 通知対象の解決が失敗したことを表す
 * なぜ: hydration の失敗方針で扱いを分けるため
 */
package com.example.inbox.service;

public class TargetResolveException extends RuntimeException {

  private final String stubId;

  public TargetResolveException(String stubId, String message, Throwable cause) {
    super(message, cause);
    this.stubId = stubId;
  }

  public String stubId() {
    return stubId;
  }
}
