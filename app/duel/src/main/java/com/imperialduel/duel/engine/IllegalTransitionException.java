package com.imperialduel.duel.engine;

public class IllegalTransitionException extends DuelRuleException {
  public IllegalTransitionException(String message) {
    super("ILLEGAL_TRANSITION", message);
  }
}
