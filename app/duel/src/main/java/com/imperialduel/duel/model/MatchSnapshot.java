/*
 * どこで: Duel ドメインモデル
 * 何を: 対戦の読み取り専用ビューを定義する
 * なぜ: 秘密の選択を含まない形でのみ状態を外へ出すため
 */
package com.imperialduel.duel.model;

import java.time.Instant;
import java.util.List;

public record MatchSnapshot(
    String contextKey,
    MatchState state,
    RoundPhase phase,
    int roundNumber,
    MatchConfig config,
    ParticipantSnapshot first,
    ParticipantSnapshot second,
    List<String> pendingParticipantIds,
    String winnerId,
    CancelReason cancelReason,
    int roundsPlayed,
    Instant createdAt) {

  public MatchSnapshot {
    pendingParticipantIds = List.copyOf(pendingParticipantIds);
  }
}
