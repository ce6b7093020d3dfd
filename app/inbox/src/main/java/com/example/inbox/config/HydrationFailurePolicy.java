/*
 * どこで: Inbox 設定
 * 何を: hydration 中に解決が失敗したときの扱いを選ぶ
 * なぜ: 一部の失敗で一覧全体を捨てるかどうかを運用で決めるため
 */
package com.example.inbox.config;

public enum HydrationFailurePolicy {
  /** 1 件でも解決に失敗したら refresh 全体を失敗させる。 */
  ABORT,
  /** 失敗した通知だけ Unknown に落として残りを採用する。 */
  DEGRADE
}
