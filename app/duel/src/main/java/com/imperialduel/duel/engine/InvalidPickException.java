package com.imperialduel.duel.engine;

public class InvalidPickException extends DuelRuleException {
  public InvalidPickException(String message) {
    super("INVALID_PICK", message);
  }
}
