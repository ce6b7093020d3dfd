/*
 * どこで: Inbox アプリのスモークテスト
 * 何を: Spring コンテキストの起動と主要 Bean の配線を確認する
 * なぜ: 主要な構成が破壊されていないことを担保するため
 */
package com.example.inbox;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.inbox.config.GithubClientProperties;
import com.example.inbox.console.InboxConsole;
import com.example.inbox.service.NotificationCoordinator;
import com.example.inbox.worker.PipelineWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    properties = {
      "github.token=test-token",
      "github.base-url=http://github.test",
      "inbox.worker.refresh-on-start=false",
      "inbox.console.enabled=false",
      "logging.file.name=target/github-inbox-test.log"
    })
class InboxApplicationTests {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoads() {
    assertThat(context.getBean(NotificationCoordinator.class)).isNotNull();
    assertThat(context.getBean(PipelineWorker.class).isRunning()).isTrue();
    assertThat(context.getBeanNamesForType(InboxConsole.class)).isEmpty();
    assertThat(context.getBean(GithubClientProperties.class).baseUrl())
        .isEqualTo("http://github.test");
  }
}
