package com.imperialduel.duel.model;

public enum ModifierScope {
  ROUND("round"),
  MATCH("match");

  private final String value;

  ModifierScope(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ModifierScope fromValue(String scope) {
    for (ModifierScope candidate : values()) {
      if (candidate.value.equalsIgnoreCase(scope)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported modifier scope: " + scope);
  }
}
