/*
 * どこで: Inbox ワーカー
 * 何を: UI からワーカーへ送る要求 (refresh、既読化、URL 解決、詳細ロード) を表す
 * なぜ: 要求の種類を閉じた型で扱い、処理漏れを防ぐため
 */
package com.example.inbox.worker;

/** ワーカーに投入する要求。1 件ずつ FIFO で処理される。 */
public interface PipelineRequest {

  /** メトリクスとログ用の種別名。 */
  String type();

  record Refresh() implements PipelineRequest {
    @Override
    public String type() {
      return "refresh";
    }
  }

  record MarkAsRead(String id) implements PipelineRequest {
    @Override
    public String type() {
      return "mark_as_read";
    }
  }

  record ResolveOpenUrl(String id) implements PipelineRequest {
    @Override
    public String type() {
      return "resolve_open_url";
    }
  }

  record OpenDetail(String id) implements PipelineRequest {
    @Override
    public String type() {
      return "open_detail";
    }
  }
}
