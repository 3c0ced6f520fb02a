package com.imperialduel.duel.engine;

public class ModifierRangeException extends DuelRuleException {
  public ModifierRangeException(String message) {
    super("MODIFIER_RANGE", message);
  }
}
