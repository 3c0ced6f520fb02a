/*
 * どこで: Duel ドメインモデル
 * 何を: 対戦形式 (best-of) と任意ルールの組を保持する
 * なぜ: 挑戦時に決めた設定を対戦終了まで不変にするため
 */
package com.imperialduel.duel.model;

import java.util.Set;

public record MatchConfig(
    int bestOf, boolean noRepeat, boolean adjacencyModifier, boolean baitSwitch) {

  public static final Set<Integer> SUPPORTED_BEST_OF = Set.of(3, 5, 7);

  public MatchConfig {
    if (!SUPPORTED_BEST_OF.contains(bestOf)) {
      throw new IllegalArgumentException("best_of must be 3, 5 or 7: " + bestOf);
    }
  }

  public static MatchConfig standard(int bestOf) {
    return new MatchConfig(bestOf, false, false, false);
  }

  /** 勝利に必要なラウンド数 (ceil(bestOf / 2))。 */
  public int winThreshold() {
    return (bestOf + 1) / 2;
  }
}
