package com.imperialduel.duel.api;

public class ModeratorAccessDeniedException extends RuntimeException {
  public ModeratorAccessDeniedException(String userId) {
    super("moderator permission required: " + userId);
  }
}
