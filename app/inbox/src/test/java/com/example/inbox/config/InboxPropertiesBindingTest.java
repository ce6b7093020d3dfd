/*
 * どこで: Inbox 設定バインドのテスト
 * 何を: hydration/worker 設定のバインドと fan-out 用プールの生成を検証する
 * なぜ: yml の表記 (failure-policy など) が起動時に正しく解釈されることを保証するため
 */
package com.example.inbox.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class InboxPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(PipelineExecutorConfig.class);

  @Test
  void bindsHydrationAndWorkerProperties() {
    contextRunner
        .withPropertyValues(
            "inbox.hydration.max-concurrency=3",
            "inbox.hydration.failure-policy=degrade",
            "inbox.hydration.discussion-search-limit=7",
            "inbox.worker.refresh-on-start=false",
            "inbox.worker.queue-capacity=8")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final HydrationProperties hydration = context.getBean(HydrationProperties.class);
              final WorkerProperties worker = context.getBean(WorkerProperties.class);

              assertThat(hydration.maxConcurrency()).isEqualTo(3);
              assertThat(hydration.failurePolicy()).isEqualTo(HydrationFailurePolicy.DEGRADE);
              assertThat(hydration.discussionSearchLimit()).isEqualTo(7);
              assertThat(worker.enabled()).isTrue();
              assertThat(worker.refreshOnStart()).isFalse();
              assertThat(worker.queueCapacity()).isEqualTo(8);
              assertThat(context).hasSingleBean(ExecutorService.class);
            });
  }

  @Test
  void defaultsApplyWhenNothingIsConfigured() {
    contextRunner.run(
        context -> {
          final HydrationProperties hydration = context.getBean(HydrationProperties.class);

          assertThat(hydration.maxConcurrency()).isEqualTo(10);
          assertThat(hydration.failurePolicy()).isEqualTo(HydrationFailurePolicy.ABORT);
        });
  }

  @Test
  void zeroConcurrencyFailsStartup() {
    contextRunner
        .withPropertyValues("inbox.hydration.max-concurrency=0")
        .run(context -> assertThat(context).hasFailed());
  }
}
