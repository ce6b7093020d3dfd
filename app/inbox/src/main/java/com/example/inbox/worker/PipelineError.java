/*
 * どこで: Inbox ワーカー
 * 何を: UI に表示するエラー (分類、メッセージ、致命かどうか) を保持する
 * なぜ: 例外の型を UI に漏らさないため
 */
package com.example.inbox.worker;

import java.util.Locale;

/** UI に出すエラー。fatal は再認証しない限り何をしても失敗することを示す。 */
public record PipelineError(ErrorCategory category, String message, boolean fatal) {

  public PipelineError {
    message =
        message == null || message.isBlank()
            ? category.name().toLowerCase(Locale.ROOT)
            : message;
  }
}
