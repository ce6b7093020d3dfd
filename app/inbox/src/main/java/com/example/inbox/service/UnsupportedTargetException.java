/*
 * どこで: Inbox サービス層
 * 何を: 詳細ロードに対応していない種別を開こうとしたことを表す
 * なぜ: CheckSuite などを NO_DETAIL として返すため
 */
package com.example.inbox.service;

import com.example.inbox.model.TargetKind;

public class UnsupportedTargetException extends RuntimeException {

  private final TargetKind kind;

  public UnsupportedTargetException(TargetKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public TargetKind kind() {
    return kind;
  }
}
