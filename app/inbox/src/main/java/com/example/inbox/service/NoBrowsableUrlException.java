/*
 * どこで: Inbox サービス層
 * 何を: ブラウザで開ける URL が見つからなかったことを表す
 * なぜ: UI に NO_BROWSABLE_URL を返すため
 */
package com.example.inbox.service;

public class NoBrowsableUrlException extends RuntimeException {

  private final String notificationId;

  public NoBrowsableUrlException(String notificationId, String message) {
    super(message);
    this.notificationId = notificationId;
  }

  public String notificationId() {
    return notificationId;
  }
}
