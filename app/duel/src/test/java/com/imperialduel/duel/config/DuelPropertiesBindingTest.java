/*
 * どこで: Duel 設定バインドのテスト
 * 何を: challenge-ttl / expiry-poll-interval の Duration とモデレーター一覧のバインドを検証する
 * なぜ: 設定ファイルの表記が起動時に正しく解釈されることを保証するため
 */
package com.imperialduel.duel.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class DuelPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "duel.challenge-ttl=5m",
              "duel.expiry-poll-interval=15s",
              "duel.expiry-enabled=false",
              "duel.moderator-ids=mod-1,mod-2");

  @Test
  void contextStartsAndBindsDurationAndModeratorFields() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final DuelProperties properties = context.getBean(DuelProperties.class);

          assertThat(properties.challengeTtl()).isEqualTo(Duration.ofMinutes(5));
          assertThat(properties.expiryPollInterval()).isEqualTo(Duration.ofSeconds(15));
          assertThat(properties.expiryEnabled()).isFalse();
          assertThat(properties.moderatorIds()).containsExactly("mod-1", "mod-2");
          assertThat(properties.isModerator("mod-2")).isTrue();
          assertThat(properties.isModerator("alice")).isFalse();
          assertThat(properties.isModerator(null)).isFalse();
        });
  }

  @Test
  void missingModeratorListBindsAsEmpty() {
    new ApplicationContextRunner()
        .withUserConfiguration(TestConfiguration.class)
        .withPropertyValues("duel.challenge-ttl=1m", "duel.expiry-poll-interval=1s")
        .run(
            context -> {
              final DuelProperties properties = context.getBean(DuelProperties.class);

              assertThat(properties.moderatorIds()).isEmpty();
              assertThat(properties.expiryEnabled()).isFalse();
            });
  }

  @Configuration
  @EnableConfigurationProperties(DuelProperties.class)
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
