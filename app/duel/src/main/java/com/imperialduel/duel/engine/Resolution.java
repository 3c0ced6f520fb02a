package com.imperialduel.duel.engine;

import com.imperialduel.duel.model.Adjacency;
import com.imperialduel.duel.model.RollBreakdown;
import com.imperialduel.duel.model.RoundOutcome;

/** Output of {@link RoundResolver}: both breakdowns plus the comparison of final values. */
public record Resolution(RollBreakdown first, RollBreakdown second, Adjacency adjacency) {

  public RoundOutcome outcome() {
    if (first.finalValue() > second.finalValue()) {
      return RoundOutcome.FIRST_PARTICIPANT;
    }
    if (second.finalValue() > first.finalValue()) {
      return RoundOutcome.SECOND_PARTICIPANT;
    }
    return RoundOutcome.TIE;
  }
}
