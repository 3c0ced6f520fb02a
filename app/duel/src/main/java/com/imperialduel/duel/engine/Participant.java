package com.imperialduel.duel.engine;

import com.imperialduel.duel.model.ActiveModifiers;
import com.imperialduel.duel.model.ParticipantSnapshot;
import com.imperialduel.duel.model.Stance;
import java.util.ArrayList;
import java.util.List;

/** Mutable per-match participant state. Only {@link Match} mutates it. */
public final class Participant {

  private final String id;
  private int wins;
  private Stance lastUsedStance;
  private final List<Stance> declaredStances = new ArrayList<>(2);
  private Stance pick;
  private boolean switchUsed;
  private boolean switchPassed;

  Participant(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public int wins() {
    return wins;
  }

  public Stance lastUsedStance() {
    return lastUsedStance;
  }

  public boolean hasDeclared() {
    return !declaredStances.isEmpty();
  }

  public boolean hasPicked() {
    return pick != null;
  }

  public boolean switchUsed() {
    return switchUsed;
  }

  boolean switchDone() {
    return switchUsed || switchPassed;
  }

  List<Stance> declaredStances() {
    return List.copyOf(declaredStances);
  }

  boolean hasDeclaredStance(Stance stance) {
    return declaredStances.contains(stance);
  }

  Stance pick() {
    return pick;
  }

  void declare(Stance first, Stance second) {
    declaredStances.clear();
    declaredStances.add(first);
    declaredStances.add(second);
  }

  void replaceDeclared(Stance oldStance, Stance newStance) {
    declaredStances.set(declaredStances.indexOf(oldStance), newStance);
    switchUsed = true;
  }

  void passSwitch() {
    switchPassed = true;
  }

  void pick(Stance stance) {
    pick = stance;
  }

  void clearPick() {
    pick = null;
  }

  void recordWin() {
    wins++;
  }

  void finishRound() {
    lastUsedStance = pick;
    resetRound();
  }

  void resetRound() {
    declaredStances.clear();
    pick = null;
    switchUsed = false;
    switchPassed = false;
  }

  ParticipantSnapshot snapshot(boolean revealDeclarations, ActiveModifiers modifiers) {
    return new ParticipantSnapshot(
        id,
        wins,
        hasDeclared(),
        revealDeclarations ? declaredStances : List.of(),
        hasPicked(),
        switchUsed,
        switchPassed,
        lastUsedStance,
        modifiers);
  }
}
