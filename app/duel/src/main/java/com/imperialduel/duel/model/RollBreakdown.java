/*
 * どこで: Duel ドメインモデル
 * 何を: 1 ラウンドにおける参加者 1 人分のロール内訳を表現する
 * なぜ: 出目・捨てた出目・補正・クランプ前後の値を表示側へそのまま渡すため
 */
package com.imperialduel.duel.model;

import java.util.List;

public record RollBreakdown(
    Stance stance,
    Relationship profile,
    List<Integer> dice,
    int keptDie,
    Integer discardedDie,
    int adjacencyModifier,
    int roundModifier,
    int matchModifier,
    int rawValue,
    int finalValue) {

  public RollBreakdown {
    dice = List.copyOf(dice);
  }

  public int totalModifier() {
    return adjacencyModifier + roundModifier + matchModifier;
  }

  public boolean clamped() {
    return rawValue != finalValue;
  }
}
