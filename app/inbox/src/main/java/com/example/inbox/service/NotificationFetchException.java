/*
 * どこで: Inbox サービス層
 * 何を: 通知一覧の取得や既読化が失敗したことを表す
 * なぜ: UI 側で FETCH として分類するため
 */
package com.example.inbox.service;

public class NotificationFetchException extends RuntimeException {

  public NotificationFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
