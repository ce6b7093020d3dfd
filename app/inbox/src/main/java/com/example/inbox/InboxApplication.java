/*
 * どこで: Inbox アプリ起動
 * 何を: Spring Boot アプリケーションを起動し、共通の Clock 設定を取り込む
 * なぜ: 非 Web のワーカーとコンソールを 1 プロセスで動かすため
 */
package com.example.inbox;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(TimeConfig.class)
public class InboxApplication {

  public static void main(String[] args) {
    SpringApplication.run(InboxApplication.class, args);
  }
}
