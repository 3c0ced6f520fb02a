package com.imperialduel.duel.engine;

import com.google.common.annotations.VisibleForTesting;
import com.imperialduel.duel.model.ActiveModifiers;
import com.imperialduel.duel.model.Adjacency;
import com.imperialduel.duel.model.Relationship;
import com.imperialduel.duel.model.RollBreakdown;
import com.imperialduel.duel.model.Stance;
import java.util.List;

/**
 * Dice combat for one round.
 *
 * <p>Only called once both picks are structurally valid, so it has no failure path of its own.
 */
public class RoundResolver {

  static final int DIE_MIN = 1;
  static final int DIE_MAX = 6;

  private final DiceRoller diceRoller;

  public RoundResolver(DiceRoller diceRoller) {
    this.diceRoller = diceRoller;
  }

  public Resolution resolve(
      Stance firstPick,
      ActiveModifiers firstModifiers,
      Stance secondPick,
      ActiveModifiers secondModifiers,
      boolean adjacencyEnabled) {
    final Relationship firstProfile = StanceTable.relationship(firstPick, secondPick);
    final Relationship secondProfile = firstProfile.inverse();
    final Adjacency adjacency = StanceTable.adjacency(firstPick, secondPick);
    final int adjacencyModifier = adjacencyEnabled ? adjacency.modifier() : 0;

    // dice are rolled first participant first so scripted rollers stay predictable
    final RollBreakdown first = roll(firstPick, firstProfile, adjacencyModifier, firstModifiers);
    final RollBreakdown second =
        roll(secondPick, secondProfile, adjacencyModifier, secondModifiers);
    return new Resolution(first, second, adjacency);
  }

  private RollBreakdown roll(
      Stance stance, Relationship profile, int adjacencyModifier, ActiveModifiers modifiers) {
    final List<Integer> dice;
    final int kept;
    final Integer discarded;
    if (profile == Relationship.NEUTRAL) {
      final int die = diceRoller.rollDie();
      dice = List.of(die);
      kept = die;
      discarded = null;
    } else {
      final int a = diceRoller.rollDie();
      final int b = diceRoller.rollDie();
      dice = List.of(a, b);
      kept = profile == Relationship.ADVANTAGE ? Math.max(a, b) : Math.min(a, b);
      discarded = profile == Relationship.ADVANTAGE ? Math.min(a, b) : Math.max(a, b);
    }
    final int raw = kept + adjacencyModifier + modifiers.round() + modifiers.match();
    return new RollBreakdown(
        stance,
        profile,
        dice,
        kept,
        discarded,
        adjacencyModifier,
        modifiers.round(),
        modifiers.match(),
        raw,
        clamp(raw));
  }

  @VisibleForTesting
  static int clamp(int value) {
    return Math.max(DIE_MIN, Math.min(DIE_MAX, value));
  }
}
