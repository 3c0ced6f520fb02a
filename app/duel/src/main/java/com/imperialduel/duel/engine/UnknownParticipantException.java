package com.imperialduel.duel.engine;

public class UnknownParticipantException extends DuelRuleException {
  public UnknownParticipantException(String participantId) {
    super("UNKNOWN_PARTICIPANT", "not a participant of this match: " + participantId);
  }
}
