/*
 * どこで: Duel ドメインモデル
 * 何を: 解決済みラウンド 1 件の不変な記録を定義する
 * なぜ: 履歴へ追記した後に書き換えられないことを型で保証するため
 */
package com.imperialduel.duel.model;

public record RoundResult(
    int roundNumber,
    String firstParticipantId,
    RollBreakdown first,
    String secondParticipantId,
    RollBreakdown second,
    Adjacency adjacency,
    RoundOutcome outcome,
    String winnerId,
    Relationship winnerRelationship,
    int firstScore,
    int secondScore) {

  public boolean tie() {
    return outcome == RoundOutcome.TIE;
  }
}
