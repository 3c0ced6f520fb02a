/*
 * どこで: Duel エンジンのテスト
 * 何を: 挑戦から決着/中止までの状態遷移とラウンド解決を検証する
 * なぜ: ルール違反時に状態が変わらないこと、秘密の選択が漏れないことを保証するため
 */
package com.imperialduel.duel.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.imperialduel.duel.model.CancelReason;
import com.imperialduel.duel.model.MatchConfig;
import com.imperialduel.duel.model.MatchSnapshot;
import com.imperialduel.duel.model.MatchState;
import com.imperialduel.duel.model.ModifierScope;
import com.imperialduel.duel.model.Relationship;
import com.imperialduel.duel.model.RoundOutcome;
import com.imperialduel.duel.model.RoundPhase;
import com.imperialduel.duel.model.RoundResult;
import com.imperialduel.duel.model.Stance;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MatchTest {

  private static final String ALICE = "alice";
  private static final String BOB = "bob";
  private static final Instant CREATED_AT = Instant.parse("2026-03-01T10:00:00Z");

  private final ScriptedDiceRoller dice = new ScriptedDiceRoller();

  private Match newMatch(MatchConfig config) {
    return new Match("channel-1", ALICE, BOB, config, new RoundResolver(dice), CREATED_AT);
  }

  private Match acceptedMatch(MatchConfig config) {
    final Match match = newMatch(config);
    match.accept(BOB);
    return match;
  }

  private void declareDefaults(Match match) {
    match.declare(ALICE, Stance.BAGR, Stance.DARDA);
    match.declare(BOB, Stance.TIGR, Stance.RIPOSJE);
  }

  @Test
  void newMatchWaitsForOpponent() {
    final Match match = newMatch(MatchConfig.standard(3));

    final MatchSnapshot snapshot = match.snapshot();

    assertThat(snapshot.state()).isEqualTo(MatchState.PENDING_CHALLENGE);
    assertThat(snapshot.pendingParticipantIds()).containsExactly(BOB);
    assertThat(snapshot.roundNumber()).isEqualTo(1);
    assertThat(snapshot.createdAt()).isEqualTo(CREATED_AT);
  }

  @Test
  void selfChallengeIsRejected() {
    assertThatThrownBy(
            () ->
                new Match(
                    "channel-1",
                    ALICE,
                    ALICE,
                    MatchConfig.standard(3),
                    new RoundResolver(dice),
                    CREATED_AT))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void onlyTheOpponentCanAccept() {
    final Match match = newMatch(MatchConfig.standard(3));

    assertThatThrownBy(() -> match.accept(ALICE)).isInstanceOf(IllegalTransitionException.class);
    assertThatThrownBy(() -> match.accept("carol"))
        .isInstanceOf(UnknownParticipantException.class);

    match.accept(BOB);

    assertThat(match.state()).isEqualTo(MatchState.ACTIVE);
    assertThat(match.phase()).isEqualTo(RoundPhase.DECLARING);
    assertThatThrownBy(() -> match.accept(BOB)).isInstanceOf(IllegalTransitionException.class);
  }

  @Test
  void declaringBeforeAcceptIsIllegal() {
    final Match match = newMatch(MatchConfig.standard(3));

    assertThatThrownBy(() -> match.declare(ALICE, Stance.BAGR, Stance.DARDA))
        .isInstanceOf(IllegalTransitionException.class);
  }

  @Test
  void declaringTheSameStanceTwiceIsInvalid() {
    final Match match = acceptedMatch(MatchConfig.standard(3));

    assertThatThrownBy(() -> match.declare(ALICE, Stance.BAGR, Stance.BAGR))
        .isInstanceOf(InvalidDeclarationException.class);
    assertThatThrownBy(() -> match.declare(ALICE, List.of(Stance.BAGR)))
        .isInstanceOf(InvalidDeclarationException.class);
    assertThat(match.snapshot().first().declared()).isFalse();
  }

  @Test
  void declarationsStayHiddenUntilBothParticipantsDeclared() {
    final Match match = acceptedMatch(MatchConfig.standard(3));

    match.declare(ALICE, Stance.BAGR, Stance.DARDA);
    match.declare(ALICE, Stance.RADAE, Stance.DARDA);
    final MatchSnapshot halfway = match.snapshot();

    assertThat(halfway.first().declared()).isTrue();
    assertThat(halfway.first().declaredStances()).isEmpty();
    assertThat(halfway.pendingParticipantIds()).containsExactly(BOB);

    match.declare(BOB, Stance.TIGR, Stance.RIPOSJE);
    final MatchSnapshot revealed = match.snapshot();

    assertThat(revealed.phase()).isEqualTo(RoundPhase.PICKING);
    assertThat(revealed.first().declaredStances()).containsExactly(Stance.RADAE, Stance.DARDA);
    assertThat(revealed.second().declaredStances()).containsExactly(Stance.TIGR, Stance.RIPOSJE);
  }

  @Test
  void firstPickIsRecordedSecretlyAndSecondPickResolves() {
    final Match match = acceptedMatch(MatchConfig.standard(3));
    declareDefaults(match);
    dice.enqueue(5, 2);

    final Optional<RoundResult> afterFirst = match.pick(ALICE, Stance.BAGR);
    final MatchSnapshot snapshot = match.snapshot();

    assertThat(afterFirst).isEmpty();
    assertThat(snapshot.first().picked()).isTrue();
    assertThat(snapshot.pendingParticipantIds()).containsExactly(BOB);
    assertThat(match.history()).isEmpty();
    assertThat(dice.remaining()).isEqualTo(2);
    assertThatThrownBy(() -> match.pick(ALICE, Stance.DARDA))
        .isInstanceOf(InvalidPickException.class);

    final RoundResult result = match.pick(BOB, Stance.TIGR).orElseThrow();

    assertThat(result.outcome()).isEqualTo(RoundOutcome.FIRST_PARTICIPANT);
    assertThat(result.winnerId()).isEqualTo(ALICE);
    assertThat(result.winnerRelationship()).isEqualTo(Relationship.NEUTRAL);
    assertThat(result.firstScore()).isEqualTo(1);
    assertThat(result.secondScore()).isZero();
    assertThat(match.history()).containsExactly(result);
    assertThat(match.roundNumber()).isEqualTo(2);
    assertThat(match.phase()).isEqualTo(RoundPhase.DECLARING);
    assertThat(match.snapshot().first().lastUsedStance()).isEqualTo(Stance.BAGR);
  }

  @Test
  void pickMustBeOneOfTheDeclaredStances() {
    final Match match = acceptedMatch(MatchConfig.standard(3));
    declareDefaults(match);

    assertThatThrownBy(() -> match.pick(ALICE, Stance.TIGR))
        .isInstanceOf(InvalidPickException.class);
    assertThat(match.snapshot().first().picked()).isFalse();
  }

  @Test
  void bestOfThreeEndsAfterTwoWinsAndRejectsFurtherActions() {
    final Match match = acceptedMatch(MatchConfig.standard(3));
    dice.enqueue(5, 2, 1, 6, 6, 1);

    declareDefaults(match);
    match.pick(ALICE, Stance.BAGR);
    match.pick(BOB, Stance.TIGR);
    declareDefaults(match);
    match.pick(ALICE, Stance.BAGR);
    final RoundResult second = match.pick(BOB, Stance.TIGR).orElseThrow();
    declareDefaults(match);
    match.pick(ALICE, Stance.BAGR);
    final RoundResult decider = match.pick(BOB, Stance.TIGR).orElseThrow();

    assertThat(second.winnerId()).isEqualTo(BOB);
    assertThat(decider.winnerId()).isEqualTo(ALICE);
    assertThat(decider.firstScore()).isEqualTo(2);
    assertThat(decider.secondScore()).isEqualTo(1);
    assertThat(match.state()).isEqualTo(MatchState.COMPLETED);
    assertThat(match.winnerId()).isEqualTo(ALICE);
    assertThat(match.roundNumber()).isEqualTo(3);
    assertThat(match.snapshot().roundsPlayed()).isEqualTo(3);
    assertThat(match.snapshot().pendingParticipantIds()).isEmpty();

    assertThatThrownBy(() -> match.declare(ALICE, Stance.BAGR, Stance.DARDA))
        .isInstanceOf(IllegalTransitionException.class);
    assertThatThrownBy(() -> match.pick(ALICE, Stance.BAGR))
        .isInstanceOf(IllegalTransitionException.class);
    assertThatThrownBy(() -> match.setModifier(ALICE, ModifierScope.MATCH, 1))
        .isInstanceOf(IllegalTransitionException.class);
    assertThat(match.cancel(CancelReason.FORCE_ENDED)).isFalse();
    assertThat(match.state()).isEqualTo(MatchState.COMPLETED);
  }

  @Test
  void tiedRoundIsRecordedAndPickedAgainFromSameDeclarations() {
    final Match match = acceptedMatch(MatchConfig.standard(3));
    declareDefaults(match);
    match.setModifier(ALICE, ModifierScope.ROUND, 1);
    dice.enqueue(2, 3);

    match.pick(ALICE, Stance.BAGR);
    final RoundResult tie = match.pick(BOB, Stance.TIGR).orElseThrow();
    final MatchSnapshot snapshot = match.snapshot();

    assertThat(tie.tie()).isTrue();
    assertThat(tie.winnerId()).isNull();
    assertThat(tie.firstScore()).isZero();
    assertThat(tie.secondScore()).isZero();
    assertThat(match.history()).containsExactly(tie);
    assertThat(snapshot.roundNumber()).isEqualTo(1);
    assertThat(snapshot.phase()).isEqualTo(RoundPhase.PICKING);
    assertThat(snapshot.roundsPlayed()).isZero();
    assertThat(snapshot.first().picked()).isFalse();
    assertThat(snapshot.second().picked()).isFalse();
    assertThat(snapshot.first().declaredStances()).containsExactly(Stance.BAGR, Stance.DARDA);
    assertThat(snapshot.first().modifiers().round()).isEqualTo(1);
    assertThat(snapshot.first().lastUsedStance()).isNull();

    dice.enqueue(6, 1);
    match.pick(ALICE, Stance.BAGR);
    final RoundResult replay = match.pick(BOB, Stance.TIGR).orElseThrow();

    assertThat(replay.roundNumber()).isEqualTo(1);
    assertThat(replay.winnerId()).isEqualTo(ALICE);
    assertThat(match.history()).hasSize(2);
  }

  @Test
  void noRepeatForbidsDeclaringLastUsedStance() {
    final Match match = acceptedMatch(new MatchConfig(3, true, false, false));
    declareDefaults(match);
    dice.enqueue(5, 2);
    match.pick(ALICE, Stance.BAGR);
    match.pick(BOB, Stance.TIGR);

    assertThatThrownBy(() -> match.declare(ALICE, Stance.RADAE, Stance.BAGR))
        .isInstanceOf(InvalidDeclarationException.class)
        .hasMessageContaining("Bagr");
    assertThat(match.snapshot().first().declared()).isFalse();

    match.declare(ALICE, Stance.RADAE, Stance.DARDA);
    assertThat(match.snapshot().first().declared()).isTrue();
  }

  @Test
  void baitSwitchCanBeUsedOncePerRound() {
    final Match match = acceptedMatch(new MatchConfig(3, false, false, true));
    declareDefaults(match);

    assertThat(match.phase()).isEqualTo(RoundPhase.SWITCHING);
    assertThatThrownBy(() -> match.pick(ALICE, Stance.BAGR))
        .isInstanceOf(IllegalTransitionException.class);

    match.switchStance(ALICE, Stance.BAGR, Stance.RADAE);

    assertThatThrownBy(() -> match.switchStance(ALICE, Stance.DARDA, Stance.TORTAD))
        .isInstanceOf(InvalidSwitchException.class);
    assertThat(match.snapshot().first().declaredStances())
        .containsExactly(Stance.RADAE, Stance.DARDA);
    assertThat(match.snapshot().first().switchUsed()).isTrue();
    assertThat(match.phase()).isEqualTo(RoundPhase.SWITCHING);

    match.passSwitch(BOB);

    assertThat(match.phase()).isEqualTo(RoundPhase.PICKING);
    assertThatThrownBy(() -> match.pick(ALICE, Stance.BAGR))
        .isInstanceOf(InvalidPickException.class);

    dice.enqueue(5, 2, 6, 4);
    match.pick(ALICE, Stance.RADAE);
    final RoundResult result = match.pick(BOB, Stance.TIGR).orElseThrow();

    assertThat(result.first().profile()).isEqualTo(Relationship.ADVANTAGE);
    assertThat(result.first().keptDie()).isEqualTo(5);
    assertThat(result.second().keptDie()).isEqualTo(4);
    assertThat(result.winnerId()).isEqualTo(ALICE);
    assertThat(match.snapshot().first().switchUsed()).isFalse();
  }

  @Test
  void secondSwitchAfterOpponentPassedIsStillAnInvalidSwitch() {
    final Match match = acceptedMatch(new MatchConfig(3, false, false, true));
    declareDefaults(match);
    match.switchStance(ALICE, Stance.BAGR, Stance.RADAE);
    match.passSwitch(BOB);

    assertThat(match.phase()).isEqualTo(RoundPhase.PICKING);
    assertThatThrownBy(() -> match.switchStance(ALICE, Stance.DARDA, Stance.TORTAD))
        .isInstanceOf(InvalidSwitchException.class);
    assertThat(match.snapshot().first().declaredStances())
        .containsExactly(Stance.RADAE, Stance.DARDA);
    assertThat(match.phase()).isEqualTo(RoundPhase.PICKING);
  }

  @Test
  void failedDiceRollLeavesSecondPickUnrecorded() {
    final Match match = acceptedMatch(MatchConfig.standard(3));
    declareDefaults(match);
    match.pick(ALICE, Stance.BAGR);

    assertThatThrownBy(() -> match.pick(BOB, Stance.TIGR))
        .isInstanceOf(IllegalStateException.class);

    final MatchSnapshot snapshot = match.snapshot();
    assertThat(snapshot.phase()).isEqualTo(RoundPhase.PICKING);
    assertThat(snapshot.first().picked()).isTrue();
    assertThat(snapshot.second().picked()).isFalse();
    assertThat(snapshot.pendingParticipantIds()).containsExactly(BOB);
    assertThat(match.history()).isEmpty();

    dice.enqueue(2, 5);
    final RoundResult result = match.pick(BOB, Stance.TIGR).orElseThrow();

    assertThat(result.winnerId()).isEqualTo(BOB);
    assertThat(match.history()).containsExactly(result);
  }

  @Test
  void switchRejectsUndeclaredSourceAndAlreadyDeclaredTarget() {
    final Match match = acceptedMatch(new MatchConfig(3, false, false, true));
    declareDefaults(match);

    assertThatThrownBy(() -> match.switchStance(ALICE, Stance.TIGR, Stance.RADAE))
        .isInstanceOf(InvalidSwitchException.class);
    assertThatThrownBy(() -> match.switchStance(ALICE, Stance.BAGR, Stance.DARDA))
        .isInstanceOf(InvalidSwitchException.class);
    assertThat(match.snapshot().first().switchUsed()).isFalse();
  }

  @Test
  void switchIsUnavailableWithoutBaitSwitchRule() {
    final Match match = acceptedMatch(MatchConfig.standard(3));
    declareDefaults(match);

    assertThatThrownBy(() -> match.switchStance(ALICE, Stance.BAGR, Stance.RADAE))
        .isInstanceOf(InvalidSwitchException.class);
    assertThatThrownBy(() -> match.passSwitch(ALICE)).isInstanceOf(InvalidSwitchException.class);
  }

  @Test
  void noRepeatAlsoAppliesToSwitchTarget() {
    final Match match = acceptedMatch(new MatchConfig(3, true, false, true));
    declareDefaults(match);
    match.passSwitch(ALICE);
    match.passSwitch(BOB);
    dice.enqueue(5, 2);
    match.pick(ALICE, Stance.BAGR);
    match.pick(BOB, Stance.TIGR);

    match.declare(ALICE, Stance.RADAE, Stance.DARDA);
    match.declare(BOB, Stance.RIPOSJE, Stance.TORTAD);

    assertThatThrownBy(() -> match.switchStance(ALICE, Stance.RADAE, Stance.BAGR))
        .isInstanceOf(InvalidSwitchException.class);
  }

  @Test
  void modifiersCanOnlyBeSetAfterBothDeclared() {
    final Match pending = newMatch(MatchConfig.standard(3));
    assertThatThrownBy(() -> pending.setModifier(ALICE, ModifierScope.ROUND, 1))
        .isInstanceOf(ModifierTimingException.class);

    final Match match = acceptedMatch(MatchConfig.standard(3));
    assertThatThrownBy(() -> match.setModifier(ALICE, ModifierScope.ROUND, 1))
        .isInstanceOf(ModifierTimingException.class);

    declareDefaults(match);
    match.setModifier(ALICE, ModifierScope.ROUND, 2);

    assertThat(match.snapshot().first().modifiers().round()).isEqualTo(2);
    assertThatThrownBy(() -> match.setModifier("carol", ModifierScope.ROUND, 1))
        .isInstanceOf(UnknownParticipantException.class);
    assertThatThrownBy(() -> match.setModifier(ALICE, ModifierScope.ROUND, 5))
        .isInstanceOf(ModifierRangeException.class);
    assertThat(match.snapshot().first().modifiers().round()).isEqualTo(2);
  }

  @Test
  void roundModifierResetsAfterRoundWhileMatchModifierPersists() {
    final Match match = acceptedMatch(new MatchConfig(5, false, false, true));
    declareDefaults(match);
    match.setModifier(ALICE, ModifierScope.ROUND, 2);
    match.setModifier(ALICE, ModifierScope.MATCH, 1);
    match.passSwitch(ALICE);
    match.passSwitch(BOB);
    dice.enqueue(2, 4);

    match.pick(ALICE, Stance.BAGR);
    final RoundResult result = match.pick(BOB, Stance.TIGR).orElseThrow();

    assertThat(result.first().roundModifier()).isEqualTo(2);
    assertThat(result.first().matchModifier()).isEqualTo(1);
    assertThat(result.first().finalValue()).isEqualTo(5);
    assertThat(result.winnerId()).isEqualTo(ALICE);
    assertThat(match.snapshot().first().modifiers().round()).isZero();
    assertThat(match.snapshot().first().modifiers().match()).isEqualTo(1);
  }

  @Test
  void adjacencyRuleAddsToBothRolls() {
    final Match match = acceptedMatch(new MatchConfig(3, false, true, false));
    match.declare(ALICE, Stance.BAGR, Stance.DARDA);
    match.declare(BOB, Stance.RADAE, Stance.TIGR);
    dice.enqueue(3, 4, 5, 2);

    match.pick(ALICE, Stance.BAGR);
    final RoundResult result = match.pick(BOB, Stance.RADAE).orElseThrow();

    assertThat(result.first().adjacencyModifier()).isEqualTo(1);
    assertThat(result.second().adjacencyModifier()).isEqualTo(1);
    assertThat(result.first().finalValue()).isEqualTo(5);
    assertThat(result.second().finalValue()).isEqualTo(3);
  }

  @Test
  void cancelKeepsResolvedHistory() {
    final Match match = acceptedMatch(MatchConfig.standard(3));
    declareDefaults(match);
    dice.enqueue(5, 2);
    match.pick(ALICE, Stance.BAGR);
    match.pick(BOB, Stance.TIGR);

    assertThat(match.cancel(CancelReason.FORCE_ENDED)).isTrue();

    assertThat(match.state()).isEqualTo(MatchState.CANCELLED);
    assertThat(match.cancelReason()).isEqualTo(CancelReason.FORCE_ENDED);
    assertThat(match.history()).hasSize(1);
    assertThat(match.cancel(CancelReason.EXPIRED)).isFalse();
    assertThat(match.cancelReason()).isEqualTo(CancelReason.FORCE_ENDED);
    assertThatThrownBy(() -> match.declare(ALICE, Stance.BAGR, Stance.DARDA))
        .isInstanceOf(IllegalTransitionException.class);
  }
}
