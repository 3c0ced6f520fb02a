package com.imperialduel.duel.engine;

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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One duel between a challenger and an opponent, from challenge to completion or cancellation.
 *
 * <p>Not thread-safe: callers serialize every action on one instance. Every mutating method
 * validates completely before touching state, so a rejected action leaves the match unchanged.
 */
public class Match {

  private final String contextKey;
  private final MatchConfig config;
  private final RoundResolver resolver;
  private final Participant first;
  private final Participant second;
  private final ModifierRegistry modifiers = new ModifierRegistry();
  private final List<RoundResult> history = new ArrayList<>();
  private final Instant createdAt;

  private volatile MatchState state = MatchState.PENDING_CHALLENGE;
  private RoundPhase phase = RoundPhase.DECLARING;
  private int roundNumber = 1;
  private String winnerId;
  private CancelReason cancelReason;

  public Match(
      String contextKey,
      String challengerId,
      String opponentId,
      MatchConfig config,
      RoundResolver resolver,
      Instant createdAt) {
    if (Objects.equals(challengerId, opponentId)) {
      throw new IllegalArgumentException("a participant cannot challenge themselves");
    }
    this.contextKey = Objects.requireNonNull(contextKey, "contextKey");
    this.first = new Participant(Objects.requireNonNull(challengerId, "challengerId"));
    this.second = new Participant(Objects.requireNonNull(opponentId, "opponentId"));
    this.config = Objects.requireNonNull(config, "config");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.createdAt = createdAt;
  }

  public String contextKey() {
    return contextKey;
  }

  public MatchConfig config() {
    return config;
  }

  public MatchState state() {
    return state;
  }

  public RoundPhase phase() {
    return phase;
  }

  public int roundNumber() {
    return roundNumber;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public String winnerId() {
    return winnerId;
  }

  public CancelReason cancelReason() {
    return cancelReason;
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  public boolean isParticipant(String participantId) {
    return first.id().equals(participantId) || second.id().equals(participantId);
  }

  public String challengerId() {
    return first.id();
  }

  public String opponentId() {
    return second.id();
  }

  public List<RoundResult> history() {
    return List.copyOf(history);
  }

  /** 挑戦を受諾する。受諾できるのは挑戦された側のみ。 */
  public void accept(String participantId) {
    final Participant participant = requireParticipant(participantId);
    if (state != MatchState.PENDING_CHALLENGE) {
      throw new IllegalTransitionException("challenge is not pending: state=" + state);
    }
    if (participant != second) {
      throw new IllegalTransitionException("only the challenged participant can accept");
    }
    state = MatchState.ACTIVE;
    phase = RoundPhase.DECLARING;
  }

  public void declare(String participantId, Stance firstStance, Stance secondStance) {
    declare(participantId, Arrays.asList(firstStance, secondStance));
  }

  /**
   * 役割: ラウンドの候補となる 2 つの構えを宣言する。
   * 動作: 両者の宣言が揃った時点で SWITCHING (bait-switch 有効時) か PICKING へ進む。相手が未宣言の間は再宣言で上書きできる。
   * 前提: stances は宣言順を保った一覧であること。
   */
  public void declare(String participantId, List<Stance> stances) {
    final Participant participant = requireParticipant(participantId);
    requireActivePhase(RoundPhase.DECLARING, "declare");
    if (stances == null || stances.size() != 2 || stances.contains(null)) {
      throw new InvalidDeclarationException("exactly two stances must be declared");
    }
    final Stance firstStance = stances.get(0);
    final Stance secondStance = stances.get(1);
    if (firstStance == secondStance) {
      throw new InvalidDeclarationException("the same stance cannot be declared twice");
    }
    if (config.noRepeat()
        && participant.lastUsedStance() != null
        && stances.contains(participant.lastUsedStance())) {
      throw new InvalidDeclarationException(
          "stance used last round cannot be declared again: "
              + participant.lastUsedStance().value());
    }

    participant.declare(firstStance, secondStance);
    if (first.hasDeclared() && second.hasDeclared()) {
      phase = config.baitSwitch() ? RoundPhase.SWITCHING : RoundPhase.PICKING;
    }
  }

  public void switchStance(String participantId, Stance oldStance, Stance newStance) {
    final Participant participant = requireSwitchableParticipant(participantId);
    if (oldStance == null || !participant.hasDeclaredStance(oldStance)) {
      throw new InvalidSwitchException("stance is not currently declared: " + describe(oldStance));
    }
    if (newStance == null || participant.hasDeclaredStance(newStance)) {
      throw new InvalidSwitchException("stance is already declared: " + describe(newStance));
    }
    if (config.noRepeat() && newStance == participant.lastUsedStance()) {
      throw new InvalidSwitchException(
          "stance used last round cannot be switched in: " + newStance.value());
    }

    participant.replaceDeclared(oldStance, newStance);
    advanceFromSwitching();
  }

  public void passSwitch(String participantId) {
    final Participant participant = requireSwitchableParticipant(participantId);
    participant.passSwitch();
    advanceFromSwitching();
  }

  /**
   * 役割: 宣言済みの構えから 1 つを秘密裏に選ぶ。
   * 動作: 2 人目の選択が記録された瞬間にラウンドを解決し、その結果を返す。1 人目の場合は empty を返す。
   * 前提: 呼び出し側が同一対戦へのアクションを直列化していること。
   */
  public Optional<RoundResult> pick(String participantId, Stance stance) {
    final Participant participant = requireParticipant(participantId);
    requireActivePhase(RoundPhase.PICKING, "pick");
    if (participant.hasPicked()) {
      throw new InvalidPickException("a stance was already picked this round");
    }
    if (stance == null || !participant.hasDeclaredStance(stance)) {
      throw new InvalidPickException("stance is not one of the declared pair: " + describe(stance));
    }

    final Participant other = participant == first ? second : first;
    if (!other.hasPicked()) {
      participant.pick(stance);
      return Optional.empty();
    }

    // ダイスは状態を変える前に振る。失敗しても選択前の状態のまま残る
    final Stance firstPick = participant == first ? stance : first.pick();
    final Stance secondPick = participant == second ? stance : second.pick();
    final Resolution resolution =
        resolver.resolve(
            firstPick,
            modifiers.getActive(first.id()),
            secondPick,
            modifiers.getActive(second.id()),
            config.adjacencyModifier());
    participant.pick(stance);
    return Optional.of(applyResolution(resolution));
  }

  public void setModifier(String participantId, ModifierScope scope, int value) {
    requireParticipant(participantId);
    if (state.isTerminal()) {
      throw new IllegalTransitionException("match is already finished: state=" + state);
    }
    if (state != MatchState.ACTIVE
        || phase == RoundPhase.DECLARING
        || phase == RoundPhase.RESOLVED) {
      throw new ModifierTimingException(
          "modifiers can only be set after both participants have declared");
    }
    modifiers.set(scope, participantId, value);
  }

  /**
   * 対戦を中止する。終端状態では何もせず false を返す。解決済みラウンドの履歴は残す。
   */
  public boolean cancel(CancelReason reason) {
    if (state.isTerminal()) {
      return false;
    }
    state = MatchState.CANCELLED;
    cancelReason = Objects.requireNonNull(reason, "reason");
    first.resetRound();
    second.resetRound();
    modifiers.clearAll();
    return true;
  }

  public MatchSnapshot snapshot() {
    final boolean reveal =
        state == MatchState.ACTIVE
            && (phase == RoundPhase.SWITCHING || phase == RoundPhase.PICKING);
    return new MatchSnapshot(
        contextKey,
        state,
        phase,
        roundNumber,
        config,
        first.snapshot(reveal, modifiers.getActive(first.id())),
        second.snapshot(reveal, modifiers.getActive(second.id())),
        pendingParticipantIds(),
        winnerId,
        cancelReason,
        (int) history.stream().filter(result -> !result.tie()).count(),
        createdAt);
  }

  private RoundResult applyResolution(Resolution resolution) {
    phase = RoundPhase.RESOLVED;
    final RoundOutcome outcome = resolution.outcome();

    if (outcome == RoundOutcome.TIE) {
      // 同点: 得点もラウンド番号も進めず、同じ宣言から選び直す
      final RoundResult tie = toResult(resolution, outcome, null, null);
      history.add(tie);
      first.clearPick();
      second.clearPick();
      phase = RoundPhase.PICKING;
      return tie;
    }

    final Participant winner = outcome == RoundOutcome.FIRST_PARTICIPANT ? first : second;
    final Relationship winnerRelationship =
        outcome == RoundOutcome.FIRST_PARTICIPANT
            ? resolution.first().profile()
            : resolution.second().profile();
    winner.recordWin();
    final RoundResult result = toResult(resolution, outcome, winner.id(), winnerRelationship);
    history.add(result);

    first.finishRound();
    second.finishRound();
    modifiers.clearRoundModifiers();

    if (winner.wins() >= config.winThreshold()) {
      state = MatchState.COMPLETED;
      winnerId = winner.id();
      modifiers.clearAll();
    } else {
      roundNumber++;
      phase = RoundPhase.DECLARING;
    }
    return result;
  }

  private RoundResult toResult(
      Resolution resolution,
      RoundOutcome outcome,
      String roundWinnerId,
      Relationship winnerRelationship) {
    return new RoundResult(
        roundNumber,
        first.id(),
        resolution.first(),
        second.id(),
        resolution.second(),
        resolution.adjacency(),
        outcome,
        roundWinnerId,
        winnerRelationship,
        first.wins(),
        second.wins());
  }

  private void advanceFromSwitching() {
    if (first.switchDone() && second.switchDone()) {
      phase = RoundPhase.PICKING;
    }
  }

  private Participant requireSwitchableParticipant(String participantId) {
    final Participant participant = requireParticipant(participantId);
    if (!config.baitSwitch()) {
      throw new InvalidSwitchException("bait-switch is not enabled for this match");
    }
    if (state == MatchState.ACTIVE && participant.switchUsed()) {
      throw new InvalidSwitchException("switch was already used this round");
    }
    requireActivePhase(RoundPhase.SWITCHING, "switch");
    if (participant.switchDone()) {
      throw new InvalidSwitchException("switch was already used or passed this round");
    }
    return participant;
  }

  private void requireActivePhase(RoundPhase expected, String action) {
    if (state != MatchState.ACTIVE) {
      throw new IllegalTransitionException(
          "cannot " + action + " while match is " + state);
    }
    if (phase != expected) {
      throw new IllegalTransitionException(
          "cannot " + action + " during phase " + phase);
    }
  }

  private Participant requireParticipant(String participantId) {
    if (first.id().equals(participantId)) {
      return first;
    }
    if (second.id().equals(participantId)) {
      return second;
    }
    throw new UnknownParticipantException(participantId);
  }

  private List<String> pendingParticipantIds() {
    if (state == MatchState.PENDING_CHALLENGE) {
      return List.of(second.id());
    }
    if (state != MatchState.ACTIVE) {
      return List.of();
    }
    final List<String> pending = new ArrayList<>(2);
    for (Participant participant : List.of(first, second)) {
      final boolean waiting =
          switch (phase) {
            case DECLARING -> !participant.hasDeclared();
            case SWITCHING -> !participant.switchDone();
            case PICKING -> !participant.hasPicked();
            case RESOLVED -> false;
          };
      if (waiting) {
        pending.add(participant.id());
      }
    }
    return pending;
  }

  private static String describe(Stance stance) {
    return stance == null ? "none" : stance.value();
  }
}
