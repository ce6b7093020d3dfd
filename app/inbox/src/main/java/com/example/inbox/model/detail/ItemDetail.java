/*
 * どこで: Inbox 詳細ビュー
 * 何を: 通知を開いたときにロードする詳細データの共通型
 * なぜ: 種別ごとの詳細を 1 つの応答で UI に渡すため
 */
package com.example.inbox.model.detail;

import com.example.inbox.model.TargetKind;

/** 通知を開いたときに遅延ロードする詳細ビューのデータ。 */
public interface ItemDetail {

  TargetKind kind();
}
