/*
 * どこで: Inbox 設定
 * 何を: ページ取得と hydration の fan-out に使う固定長スレッドプールを提供する
 * なぜ: 同時に飛ばす GitHub リクエスト数を max-concurrency で頭打ちにするため
 */
package com.example.inbox.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({HydrationProperties.class, WorkerProperties.class})
public class PipelineExecutorConfig {

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService fanOutExecutor(HydrationProperties properties) {
    return Executors.newFixedThreadPool(
        properties.maxConcurrency(),
        new ThreadFactoryBuilder().setNameFormat("inbox-fanout-%d").setDaemon(true).build());
  }
}
