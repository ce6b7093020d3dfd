/*
 * どこで: Inbox 設定
 * 何を: GitHub API 呼び出し設定 (baseUrl/token/パス/タイムアウト) を保持する
 * なぜ: エンドポイントと呼び出し期限を環境ごとに切り替えるため
 */
package com.example.inbox.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "github")
@Validated
public record GithubClientProperties(
    String baseUrl,
    String token,
    String notificationsPath,
    String markReadPath,
    String graphqlPath,
    @Min(1) @Max(50) Integer perPage,
    String userAgent,
    Duration connectTimeout,
    Duration readTimeout) {

  public GithubClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.github.com" : baseUrl;
    token = token == null ? "" : token.trim();
    notificationsPath =
        notificationsPath == null || notificationsPath.isBlank()
            ? "/notifications"
            : notificationsPath;
    markReadPath =
        markReadPath == null || markReadPath.isBlank()
            ? "/notifications/threads/{threadId}"
            : markReadPath;
    graphqlPath = graphqlPath == null || graphqlPath.isBlank() ? "/graphql" : graphqlPath;
    // GitHub の notifications は 1 ページ最大 50 件
    perPage = perPage == null ? 50 : perPage;
    userAgent = userAgent == null || userAgent.isBlank() ? "github-inbox" : userAgent;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(20) : readTimeout;
  }

  @AssertTrue(message = "github.connect-timeout must be positive")
  public boolean isConnectTimeoutPositive() {
    return isPositiveDuration(connectTimeout);
  }

  @AssertTrue(message = "github.read-timeout must be positive")
  public boolean isReadTimeoutPositive() {
    return isPositiveDuration(readTimeout);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
