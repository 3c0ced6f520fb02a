/*
 * どこで: Duel アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: API + 期限切れ Worker を単一アプリとして起動するため
 */
package com.imperialduel.duel;

import com.imperialduel.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DuelApplication {

  public static void main(String[] args) {
    SpringApplication.run(DuelApplication.class, args);
  }
}
