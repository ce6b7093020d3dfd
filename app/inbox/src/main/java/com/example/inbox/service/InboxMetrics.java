/*
 * どこで: Inbox メトリクス
 * 何を: ワーカー要求、解決結果、GitHub エラー、refresh 所要時間、キャッシュ件数を Micrometer に記録する
 * なぜ: メーター名とタグをここに集め、呼び出し側を単純にするため
 */
package com.example.inbox.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class InboxMetrics {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final MeterRegistry meterRegistry;

  private final Timer refreshTimer;
  private final AtomicLong cacheSize = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> resolveCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> githubErrorCounters = new ConcurrentHashMap<>();

  public InboxMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.refreshTimer =
        Timer.builder("inbox.refresh.duration")
            .description("Time taken by a full fetch and hydrate cycle")
            .register(meterRegistry);
    Gauge.builder("inbox.cache.size", cacheSize, AtomicLong::get)
        .description("Notifications currently held in the cache")
        .register(meterRegistry);
  }

  public void recordRequest(String type, String result) {
    final String key = type + ":" + result;
    requestCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder("inbox.pipeline.request.total")
                    .tags(Tags.of("type", type, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRefreshDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    refreshTimer.record(duration);
  }

  public void recordResolve(String kind, String result) {
    final String key = kind + ":" + result;
    resolveCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder("inbox.hydration.resolve.total")
                    .tags(Tags.of("kind", kind, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordGithubError(GithubIntegrationException.Reason reason) {
    final String tag = reason.name().toLowerCase(Locale.ROOT);
    githubErrorCounters
        .computeIfAbsent(tag, this::registerGithubErrorCounter)
        .increment();
  }

  public void updateCacheSize(int size) {
    cacheSize.set(Math.max(0, size));
  }

  private Counter registerGithubErrorCounter(String reason) {
    return Counter.builder("inbox.github.error.total")
        .tags(Tags.of("reason", reason))
        .register(meterRegistry);
  }
}
