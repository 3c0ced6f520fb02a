/*
 * どこで: Duel エンジン設定
 * 何を: ダイスの乱数源とラウンド解決器を Bean として提供する
 * なぜ: Spring に依存しないエンジンをサービス層へ注入するため
 */
package com.imperialduel.duel.config;

import com.imperialduel.duel.engine.DiceRoller;
import com.imperialduel.duel.engine.RandomDiceRoller;
import com.imperialduel.duel.engine.RoundResolver;
import java.security.SecureRandom;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DuelEngineConfig {

  @Bean
  DiceRoller diceRoller() {
    return new RandomDiceRoller(new SecureRandom());
  }

  @Bean
  RoundResolver roundResolver(DiceRoller diceRoller) {
    return new RoundResolver(diceRoller);
  }
}
