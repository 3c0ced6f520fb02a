package com.imperialduel.duel.engine;

import java.util.random.RandomGenerator;

public class RandomDiceRoller implements DiceRoller {

  private final RandomGenerator random;

  public RandomDiceRoller(RandomGenerator random) {
    this.random = random;
  }

  @Override
  public int rollDie() {
    return 1 + random.nextInt(6);
  }
}
