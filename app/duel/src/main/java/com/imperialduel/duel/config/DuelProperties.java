/*
 * どこで: Duel 設定
 * 何を: 挑戦の有効期限・期限切れ Worker・モデレーターの設定を保持する
 * なぜ: 運用で変わる値をコード外へ出し、テストで上書きしやすくするため
 */
package com.imperialduel.duel.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "duel")
public record DuelProperties(
    Duration challengeTtl,
    Duration expiryPollInterval,
    boolean expiryEnabled,
    List<String> moderatorIds) {

  public DuelProperties {
    moderatorIds = moderatorIds == null ? List.of() : List.copyOf(moderatorIds);
  }

  public boolean isModerator(String userId) {
    return userId != null && moderatorIds.contains(userId);
  }
}
