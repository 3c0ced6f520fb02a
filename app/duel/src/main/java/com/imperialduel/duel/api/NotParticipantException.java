package com.imperialduel.duel.api;

public class NotParticipantException extends RuntimeException {
  public NotParticipantException(String userId) {
    super("user is not part of this match: " + userId);
  }
}
