package com.imperialduel.duel.engine;

public class InvalidDeclarationException extends DuelRuleException {
  public InvalidDeclarationException(String message) {
    super("INVALID_DECLARATION", message);
  }
}
