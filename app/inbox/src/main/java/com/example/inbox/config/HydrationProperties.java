/*
 * どこで: Inbox 設定
 * 何を: hydration の同時実行上限と失敗時ポリシーを保持する
 * なぜ: GitHub のレート制限に合わせて fan-out 幅を調整できるようにするため
 */
package com.example.inbox.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "inbox.hydration")
@Validated
public record HydrationProperties(
    @NotNull @Min(1) @Max(64) Integer maxConcurrency,
    @NotNull HydrationFailurePolicy failurePolicy,
    @NotNull @Positive Integer discussionSearchLimit) {

  public HydrationProperties {
    maxConcurrency = maxConcurrency == null ? 10 : maxConcurrency;
    failurePolicy = failurePolicy == null ? HydrationFailurePolicy.ABORT : failurePolicy;
    discussionSearchLimit = discussionSearchLimit == null ? 5 : discussionSearchLimit;
  }
}
