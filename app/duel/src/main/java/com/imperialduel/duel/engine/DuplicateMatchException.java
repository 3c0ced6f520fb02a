package com.imperialduel.duel.engine;

public class DuplicateMatchException extends DuelRuleException {
  public DuplicateMatchException(String contextKey) {
    super("DUPLICATE_MATCH", "an active match already exists in context: " + contextKey);
  }
}
