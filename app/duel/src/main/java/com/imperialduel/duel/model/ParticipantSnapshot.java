package com.imperialduel.duel.model;

import java.util.List;

/** 参加者の公開情報。選択中の構え (pick) は持たない。 */
public record ParticipantSnapshot(
    String participantId,
    int wins,
    boolean declared,
    List<Stance> declaredStances,
    boolean picked,
    boolean switchUsed,
    boolean switchPassed,
    Stance lastUsedStance,
    ActiveModifiers modifiers) {

  public ParticipantSnapshot {
    declaredStances = List.copyOf(declaredStances);
  }
}
