/*
 * どこで: Common 共通設定
 * 何を: マイクロ秒に丸めた UTC の Clock を DI 可能にする
 * なぜ: timestamptz の精度と揃え、ページングカーソルの時刻比較を保存値と一致させるため
 */
package io.eventboard.common.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  static final Duration STORAGE_PRECISION = Duration.ofNanos(1_000);

  @Bean
  public Clock clock() {
    return Clock.tick(Clock.systemUTC(), STORAGE_PRECISION);
  }
}
