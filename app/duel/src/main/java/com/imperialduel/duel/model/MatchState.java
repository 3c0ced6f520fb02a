/*
 * どこで: Duel ドメインモデル
 * 何を: 対戦のライフサイクル状態を定義する
 * なぜ: API 応答と状態遷移の判定を一貫させるため
 */
package com.imperialduel.duel.model;

public enum MatchState {
  PENDING_CHALLENGE,
  ACTIVE,
  COMPLETED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }
}
