package com.imperialduel.duel.engine;

public class InvalidSwitchException extends DuelRuleException {
  public InvalidSwitchException(String message) {
    super("INVALID_SWITCH", message);
  }
}
