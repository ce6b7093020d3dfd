/*
 * どこで: Inbox 詳細ビュー
 * 何を: Release のメタ情報を詳細ビューとして包む
 * なぜ: タイムラインを持たない対象も同じ詳細ビューで扱うため
 */
package com.example.inbox.model.detail;

import com.example.inbox.model.ReleaseMeta;
import com.example.inbox.model.TargetKind;

public record ReleaseDetail(ReleaseMeta meta) implements ItemDetail {

  @Override
  public TargetKind kind() {
    return TargetKind.RELEASE;
  }
}
