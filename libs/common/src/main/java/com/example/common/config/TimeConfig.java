/*
 * どこで: Common 共通設定
 * 何を: 通知 refresh の所要時間計測に使う、ミリ秒刻みの UTC Clock を Bean として提供する
 * なぜ: Timer に記録する所要時間をミリ秒単位に揃え、テストでは任意の Clock に差し替えるため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  /** GitHub のタイムスタンプと同じ UTC で、ミリ秒未満は切り捨てる。 */
  @Bean
  public Clock clock() {
    return Clock.tickMillis(ZoneOffset.UTC);
  }
}
