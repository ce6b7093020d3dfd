/*
 * どこで: Inbox 設定
 * 何を: inbox.worker.* (有効化、起動時 refresh、キュー容量) を束ねる
 * なぜ: ワーカーの挙動を設定ファイルから切り替えるため
 */
package com.example.inbox.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "inbox.worker")
@Validated
public record WorkerProperties(
    Boolean enabled, Boolean refreshOnStart, @Positive Integer queueCapacity) {

  public WorkerProperties {
    enabled = enabled == null || enabled;
    refreshOnStart = refreshOnStart == null || refreshOnStart;
    queueCapacity = queueCapacity == null ? 64 : queueCapacity;
  }
}
