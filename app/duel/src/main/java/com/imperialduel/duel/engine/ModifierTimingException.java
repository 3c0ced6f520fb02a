package com.imperialduel.duel.engine;

public class ModifierTimingException extends DuelRuleException {
  public ModifierTimingException(String message) {
    super("MODIFIER_TIMING", message);
  }
}
