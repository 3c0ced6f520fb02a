package com.imperialduel.duel.service;

import com.imperialduel.duel.api.response.MatchStatusResponse;
import com.imperialduel.duel.api.response.ModifierStatusResponse;
import com.imperialduel.duel.api.response.ParticipantStatusResponse;
import com.imperialduel.duel.api.response.RollResponse;
import com.imperialduel.duel.api.response.RoundResultResponse;
import com.imperialduel.duel.api.response.RulesResponse;
import com.imperialduel.duel.engine.ModifierRegistry;
import com.imperialduel.duel.engine.StanceTable;
import com.imperialduel.duel.model.ActiveModifiers;
import com.imperialduel.duel.model.MatchSnapshot;
import com.imperialduel.duel.model.MatchConfig;
import com.imperialduel.duel.model.ParticipantSnapshot;
import com.imperialduel.duel.model.RollBreakdown;
import com.imperialduel.duel.model.RoundResult;
import com.imperialduel.duel.model.Stance;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversions from engine snapshots and results to API responses. */
final class DuelResponses {

  private DuelResponses() {}

  static MatchStatusResponse toStatus(MatchSnapshot snapshot) {
    final MatchConfig config = snapshot.config();
    return new MatchStatusResponse(
        snapshot.contextKey(),
        snapshot.state().name(),
        snapshot.phase().name(),
        snapshot.roundNumber(),
        config.bestOf(),
        config.winThreshold(),
        config.noRepeat(),
        config.adjacencyModifier(),
        config.baitSwitch(),
        List.of(toParticipant(snapshot.first()), toParticipant(snapshot.second())),
        snapshot.pendingParticipantIds(),
        snapshot.winnerId(),
        snapshot.cancelReason() == null ? null : snapshot.cancelReason().name(),
        snapshot.roundsPlayed());
  }

  static RoundResultResponse toRound(RoundResult result) {
    final Map<String, Integer> score = new LinkedHashMap<>();
    score.put(result.firstParticipantId(), result.firstScore());
    score.put(result.secondParticipantId(), result.secondScore());
    return new RoundResultResponse(
        result.roundNumber(),
        toRoll(result.firstParticipantId(), result.first()),
        toRoll(result.secondParticipantId(), result.second()),
        result.adjacency().name(),
        result.outcome().name(),
        result.winnerId(),
        result.winnerRelationship() == null ? null : result.winnerRelationship().name(),
        score);
  }

  static RulesResponse rules() {
    final Map<String, List<String>> advantages = new LinkedHashMap<>();
    final Map<String, List<String>> disadvantages = new LinkedHashMap<>();
    for (Stance stance : Stance.values()) {
      advantages.put(stance.value(), names(StanceTable.advantagedAgainst(stance)));
      disadvantages.put(stance.value(), names(StanceTable.disadvantagedAgainst(stance)));
    }
    final Map<String, String> dice = new LinkedHashMap<>();
    dice.put("ADVANTAGE", "roll 2d6, keep the higher");
    dice.put("NEUTRAL", "roll 1d6");
    dice.put("DISADVANTAGE", "roll 2d6, keep the lower");
    return new RulesResponse(
        names(Arrays.asList(Stance.values())),
        advantages,
        disadvantages,
        dice,
        MatchConfig.SUPPORTED_BEST_OF.stream().sorted().toList(),
        ModifierRegistry.MIN_VALUE,
        ModifierRegistry.MAX_VALUE);
  }

  private static ParticipantStatusResponse toParticipant(ParticipantSnapshot participant) {
    final ActiveModifiers modifiers = participant.modifiers();
    return new ParticipantStatusResponse(
        participant.participantId(),
        participant.wins(),
        participant.declared(),
        names(participant.declaredStances()),
        participant.picked(),
        participant.switchUsed(),
        participant.lastUsedStance() == null ? null : participant.lastUsedStance().value(),
        new ModifierStatusResponse(modifiers.round(), modifiers.match(), modifiers.total()));
  }

  private static RollResponse toRoll(String participantId, RollBreakdown roll) {
    return new RollResponse(
        participantId,
        roll.stance().value(),
        roll.profile().name(),
        roll.dice(),
        roll.keptDie(),
        roll.discardedDie(),
        roll.adjacencyModifier(),
        roll.roundModifier(),
        roll.matchModifier(),
        roll.totalModifier(),
        roll.rawValue(),
        roll.finalValue());
  }

  private static List<String> names(List<Stance> stances) {
    return stances.stream().map(Stance::value).toList();
  }
}
