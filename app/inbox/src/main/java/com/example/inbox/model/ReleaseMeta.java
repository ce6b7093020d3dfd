/*
 * どこで: Inbox ドメインモデル
 * 何を: Release 通知の解決結果 (タグ名、本文など) を保持する
 * なぜ: 番号を持たない対象も一覧に並べるため
 */
package com.example.inbox.model;

public record ReleaseMeta(
    RepoMeta repo, String title, String body, String author, String tagName, String htmlUrl)
    implements NotificationTarget {

  @Override
  public TargetKind kind() {
    return TargetKind.RELEASE;
  }
}
