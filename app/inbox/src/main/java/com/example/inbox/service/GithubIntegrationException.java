/*
 * どこで: Inbox サービス層
 * 何を: GitHub API 呼び出しの失敗を理由付きで表現する
 * なぜ: 認証エラーやレート制限をワーカー境界で個別のメッセージに変換するため
 */
package com.example.inbox.service;

import java.util.Optional;

public class GithubIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    FORBIDDEN,
    RATE_LIMITED,
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public GithubIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public GithubIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /** cause チェーンを辿って最初に見つかった GitHub 連携エラーを返す。 */
  public static Optional<GithubIntegrationException> findIn(Throwable throwable) {
    Throwable current = throwable;
    while (current != null) {
      if (current instanceof GithubIntegrationException integration) {
        return Optional.of(integration);
      }
      current = current.getCause();
    }
    return Optional.empty();
  }
}
