/*
 * どこで: Inbox ドメインモデル
 * 何を: 通知 subject の type 文字列を既知の種別に分類する
 * なぜ: 解決処理の振り分けを文字列比較に依存させないため
 */
package com.example.inbox.model;

public enum SubjectType {
  ISSUE("Issue"),
  PULL_REQUEST("PullRequest"),
  RELEASE("Release"),
  DISCUSSION("Discussion"),
  CHECK_SUITE("CheckSuite"),
  UNKNOWN("");

  private final String tag;

  SubjectType(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  /** 大文字小文字を区別する完全一致。未知のタグは {@link #UNKNOWN}。 */
  public static SubjectType classify(String tag) {
    if (tag == null || tag.isEmpty()) {
      return UNKNOWN;
    }
    for (SubjectType type : values()) {
      if (type != UNKNOWN && type.tag.equals(tag)) {
        return type;
      }
    }
    return UNKNOWN;
  }
}
