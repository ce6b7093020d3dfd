/*
 * どこで: GitHub API DTO
 * 何を: 通知一覧 1 ページ分と総ページ数を保持する
 * なぜ: 残りページの取得を並列に計画するため
 */
package com.example.inbox.service.dto;

import java.util.List;

/** lastPage は Link ヘッダの rel="last" から読んだ総ページ数。ヘッダが無ければ現在ページ。 */
public record NotificationPage(List<NotificationThreadResponse> items, int lastPage) {

  public NotificationPage {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
