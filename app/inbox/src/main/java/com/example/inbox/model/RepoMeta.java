/*
 * どこで: Inbox ドメインモデル
 * 何を: 通知が属するリポジトリの owner と name を保持する
 * なぜ: API 応答に欠けがあっても表示が崩れないようにするため
 */
package com.example.inbox.model;

public record RepoMeta(String owner, String name) {

  public RepoMeta {
    owner = owner == null ? "" : owner;
    name = name == null ? "" : name;
  }

  public String fullName() {
    return owner + "/" + name;
  }
}
