package com.imperialduel.duel.model;

/** ACTIVE な対戦におけるラウンド内の段階。 */
public enum RoundPhase {
  DECLARING,
  SWITCHING,
  PICKING,
  RESOLVED
}
