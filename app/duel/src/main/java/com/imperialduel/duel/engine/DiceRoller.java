package com.imperialduel.duel.engine;

/** Source of independent, uniformly distributed d6 values. */
@FunctionalInterface
public interface DiceRoller {

  /** Returns an integer in [1, 6]. */
  int rollDie();
}
