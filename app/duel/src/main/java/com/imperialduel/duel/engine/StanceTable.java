package com.imperialduel.duel.engine;

import com.imperialduel.duel.model.Adjacency;
import com.imperialduel.duel.model.Relationship;
import com.imperialduel.duel.model.Stance;
import java.util.ArrayList;
import java.util.List;

/**
 * Static relationship data over the six stances.
 *
 * <p>For an ordered pair (A, B) with {@code d = (pos(B) - pos(A)) mod 6}: 1 or 2 is an advantage
 * for A, 4 or 5 a disadvantage, 0 and 3 are neutral.
 */
public final class StanceTable {

  private static final int SIZE = Stance.values().length;

  private StanceTable() {}

  public static int cyclicDistance(Stance from, Stance to) {
    return Math.floorMod(to.position() - from.position(), SIZE);
  }

  public static Relationship relationship(Stance attacker, Stance defender) {
    final int distance = cyclicDistance(attacker, defender);
    return switch (distance) {
      case 1, 2 -> Relationship.ADVANTAGE;
      case 4, 5 -> Relationship.DISADVANTAGE;
      default -> Relationship.NEUTRAL;
    };
  }

  public static Adjacency adjacency(Stance first, Stance second) {
    final int distance = cyclicDistance(first, second);
    return switch (distance) {
      case 1, 5 -> Adjacency.ADJACENT;
      case 3 -> Adjacency.OPPOSITE;
      default -> Adjacency.OTHER;
    };
  }

  /** Stances the given stance has an advantage over, in clockwise order. */
  public static List<Stance> advantagedAgainst(Stance stance) {
    return collect(stance, Relationship.ADVANTAGE);
  }

  public static List<Stance> disadvantagedAgainst(Stance stance) {
    return collect(stance, Relationship.DISADVANTAGE);
  }

  private static List<Stance> collect(Stance stance, Relationship wanted) {
    final List<Stance> result = new ArrayList<>();
    for (int step = 1; step < SIZE; step++) {
      final Stance other = Stance.values()[(stance.position() + step) % SIZE];
      if (relationship(stance, other) == wanted) {
        result.add(other);
      }
    }
    return List.copyOf(result);
  }
}
