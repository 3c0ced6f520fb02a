package com.imperialduel.duel.service;

import com.imperialduel.duel.api.InvalidDuelRequestException;
import com.imperialduel.duel.api.MatchNotFoundException;
import com.imperialduel.duel.api.ModeratorAccessDeniedException;
import com.imperialduel.duel.api.NotParticipantException;
import com.imperialduel.duel.api.request.ChallengeRequest;
import com.imperialduel.duel.api.request.DeclareRequest;
import com.imperialduel.duel.api.request.ModifierRequest;
import com.imperialduel.duel.api.request.PickRequest;
import com.imperialduel.duel.api.request.SwitchRequest;
import com.imperialduel.duel.api.response.CancelResponse;
import com.imperialduel.duel.api.response.MatchStatusResponse;
import com.imperialduel.duel.api.response.PickResponse;
import com.imperialduel.duel.api.response.RoundResultResponse;
import com.imperialduel.duel.api.response.RulesResponse;
import com.imperialduel.duel.config.DuelProperties;
import com.imperialduel.duel.engine.DuelRuleException;
import com.imperialduel.duel.engine.Match;
import com.imperialduel.duel.engine.RoundResolver;
import com.imperialduel.duel.model.CancelReason;
import com.imperialduel.duel.model.MatchConfig;
import com.imperialduel.duel.model.MatchState;
import com.imperialduel.duel.model.ModifierScope;
import com.imperialduel.duel.model.RoundResult;
import com.imperialduel.duel.model.Stance;
import com.imperialduel.duel.repository.MatchRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Embeds the duel engine: looks matches up by context key, serializes every action on one match
 * and translates between API payloads and engine types.
 */
@Service
public class DuelService {

  private static final Logger logger = LoggerFactory.getLogger(DuelService.class);
  private static final int DEFAULT_BEST_OF = 3;

  private final MatchRepository matchRepository;
  private final RoundResolver roundResolver;
  private final DuelProperties properties;
  private final DuelMetrics metrics;
  private final Clock clock;

  public DuelService(
      MatchRepository matchRepository,
      RoundResolver roundResolver,
      DuelProperties properties,
      DuelMetrics metrics,
      Clock clock) {
    this.matchRepository = matchRepository;
    this.roundResolver = roundResolver;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  public MatchStatusResponse challenge(
      String contextKey, String challengerId, ChallengeRequest request) {
    validateContextAndUser(contextKey, challengerId);
    if (request == null || isBlank(request.opponentId())) {
      throw new InvalidDuelRequestException("opponent_id is required");
    }
    if (challengerId.equals(request.opponentId())) {
      throw new InvalidDuelRequestException("you cannot challenge yourself");
    }
    final MatchConfig config = parseConfig(request);
    final Match match;
    try {
      match =
          matchRepository.create(
              contextKey,
              () ->
                  new Match(
                      contextKey,
                      challengerId,
                      request.opponentId(),
                      config,
                      roundResolver,
                      Instant.now(clock)));
    } catch (DuelRuleException ex) {
      metrics.recordRejectedAction(ex.code());
      throw ex;
    }
    metrics.recordChallenge();
    refreshActiveMatches();
    logger.info(
        "challenge issued contextKey={} challenger={} opponent={} bestOf={}",
        contextKey,
        challengerId,
        request.opponentId(),
        config.bestOf());
    synchronized (match) {
      return DuelResponses.toStatus(match.snapshot());
    }
  }

  public MatchStatusResponse accept(String contextKey, String userId) {
    return withParticipantMatch(
        contextKey,
        userId,
        match -> {
          match.accept(userId);
          logger.info("challenge accepted contextKey={} opponent={}", contextKey, userId);
          return DuelResponses.toStatus(match.snapshot());
        });
  }

  public MatchStatusResponse declare(String contextKey, String userId, DeclareRequest request) {
    if (request == null) {
      throw new InvalidDuelRequestException("request is required");
    }
    final Stance first = parseStance(request.first());
    final Stance second = parseStance(request.second());
    return withParticipantMatch(
        contextKey,
        userId,
        match -> {
          match.declare(userId, first, second);
          logger.debug("stances declared contextKey={} participant={}", contextKey, userId);
          return DuelResponses.toStatus(match.snapshot());
        });
  }

  public MatchStatusResponse switchStance(
      String contextKey, String userId, SwitchRequest request) {
    if (request == null) {
      throw new InvalidDuelRequestException("request is required");
    }
    final Stance oldStance = parseStance(request.oldStance());
    final Stance newStance = parseStance(request.newStance());
    return withParticipantMatch(
        contextKey,
        userId,
        match -> {
          match.switchStance(userId, oldStance, newStance);
          logger.info(
              "stance switched contextKey={} participant={} old={} new={}",
              contextKey,
              userId,
              oldStance.value(),
              newStance.value());
          return DuelResponses.toStatus(match.snapshot());
        });
  }

  public MatchStatusResponse passSwitch(String contextKey, String userId) {
    return withParticipantMatch(
        contextKey,
        userId,
        match -> {
          match.passSwitch(userId);
          return DuelResponses.toStatus(match.snapshot());
        });
  }

  /**
   * Records a secret pick. The response to the first picker only acknowledges receipt; the second
   * pick resolves the round and returns its result.
   */
  public PickResponse pick(String contextKey, String userId, PickRequest request) {
    if (request == null) {
      throw new InvalidDuelRequestException("request is required");
    }
    final Stance stance = parseStance(request.stance());
    return withParticipantMatch(
        contextKey,
        userId,
        match -> {
          final Optional<RoundResult> resolved = match.pick(userId, stance);
          if (resolved.isEmpty()) {
            return new PickResponse("ACCEPTED", stance.value(), null);
          }
          final RoundResult result = resolved.get();
          onRoundResolved(match, result);
          return new PickResponse("RESOLVED", stance.value(), DuelResponses.toRound(result));
        });
  }

  public MatchStatusResponse setModifier(
      String contextKey, String moderatorId, ModifierRequest request) {
    validateContextAndUser(contextKey, moderatorId);
    ensureModerator(moderatorId);
    if (request == null || request.value() == null) {
      throw new InvalidDuelRequestException("value is required");
    }
    final ModifierScope scope = parseScope(request.scope());
    return withMatch(
        contextKey,
        match -> {
          match.setModifier(request.participantId(), scope, request.value());
          logger.info(
              "modifier set contextKey={} moderator={} participant={} scope={} value={}",
              contextKey,
              moderatorId,
              request.participantId(),
              scope.value(),
              request.value());
          return DuelResponses.toStatus(match.snapshot());
        });
  }

  public MatchStatusResponse getStatus(String contextKey) {
    return withMatch(contextKey, match -> DuelResponses.toStatus(match.snapshot()));
  }

  public List<RoundResultResponse> getRounds(String contextKey) {
    return withMatch(
        contextKey, match -> match.history().stream().map(DuelResponses::toRound).toList());
  }

  public CancelResponse cancel(String contextKey, String userId) {
    return withParticipantMatch(
        contextKey,
        userId,
        match -> {
          final CancelReason reason =
              match.state() == MatchState.PENDING_CHALLENGE && userId.equals(match.challengerId())
                  ? CancelReason.WITHDRAWN
                  : CancelReason.CANCELLED_BY_PARTICIPANT;
          return cancelMatch(match, reason, userId);
        });
  }

  public CancelResponse forceEnd(String contextKey, String moderatorId) {
    validateContextAndUser(contextKey, moderatorId);
    ensureModerator(moderatorId);
    return withMatch(contextKey, match -> cancelMatch(match, CancelReason.FORCE_ENDED, moderatorId));
  }

  public RulesResponse rules() {
    return DuelResponses.rules();
  }

  /**
   * 役割: 期限切れの挑戦を中止する。
   * 動作: 作成時刻 + challenge-ttl が now 以前の PENDING_CHALLENGE を EXPIRED で中止し、件数を返す。
   * 前提: challenge-ttl が設定されていること。
   */
  public int expirePendingChallenges(Instant now) {
    final Instant cutoff = now.minus(properties.challengeTtl());
    int expired = 0;
    for (Match match : matchRepository.findByState(MatchState.PENDING_CHALLENGE)) {
      synchronized (match) {
        if (match.state() != MatchState.PENDING_CHALLENGE || match.createdAt().isAfter(cutoff)) {
          continue;
        }
        match.cancel(CancelReason.EXPIRED);
      }
      expired++;
      metrics.recordMatchFinished(resultTag(CancelReason.EXPIRED));
      logger.info("challenge expired contextKey={}", match.contextKey());
    }
    if (expired > 0) {
      refreshActiveMatches();
    }
    return expired;
  }

  public long countInProgress() {
    return matchRepository.countInProgress();
  }

  private CancelResponse cancelMatch(Match match, CancelReason reason, String actorId) {
    if (match.cancel(reason)) {
      metrics.recordMatchFinished(resultTag(reason));
      refreshActiveMatches();
      logger.info(
          "match cancelled contextKey={} reason={} by={} rounds={}",
          match.contextKey(),
          reason,
          actorId,
          match.history().size());
    }
    return new CancelResponse(
        match.contextKey(),
        match.state().name(),
        match.cancelReason() == null ? null : match.cancelReason().name());
  }

  private void onRoundResolved(Match match, RoundResult result) {
    metrics.recordRound(result.tie() ? "tie" : "decisive");
    logger.info(
        "round resolved contextKey={} round={} outcome={} score={}-{}",
        match.contextKey(),
        result.roundNumber(),
        result.outcome(),
        result.firstScore(),
        result.secondScore());
    if (match.state() == MatchState.COMPLETED) {
      metrics.recordMatchFinished("completed");
      refreshActiveMatches();
      logger.info(
          "match completed contextKey={} winner={} rounds={}",
          match.contextKey(),
          match.winnerId(),
          match.history().size());
    }
  }

  private void refreshActiveMatches() {
    metrics.updateActiveMatches(matchRepository.countInProgress());
  }

  private <T> T withParticipantMatch(
      String contextKey, String userId, Function<Match, T> action) {
    validateContextAndUser(contextKey, userId);
    return withMatch(
        contextKey,
        match -> {
          if (!match.isParticipant(userId)) {
            throw new NotParticipantException(userId);
          }
          return action.apply(match);
        });
  }

  private <T> T withMatch(String contextKey, Function<Match, T> action) {
    if (isBlank(contextKey)) {
      throw new InvalidDuelRequestException("contextKey is required");
    }
    final Match match =
        matchRepository
            .findByContextKey(contextKey)
            .orElseThrow(() -> new MatchNotFoundException(contextKey));
    synchronized (match) {
      try {
        return action.apply(match);
      } catch (DuelRuleException ex) {
        metrics.recordRejectedAction(ex.code());
        logger.debug(
            "action rejected contextKey={} code={} message={}",
            contextKey,
            ex.code(),
            ex.getMessage());
        throw ex;
      }
    }
  }

  private MatchConfig parseConfig(ChallengeRequest request) {
    final int bestOf = request.bestOf() == null ? DEFAULT_BEST_OF : request.bestOf();
    try {
      return new MatchConfig(
          bestOf, request.noRepeat(), request.adjacencyModifier(), request.baitSwitch());
    } catch (IllegalArgumentException ex) {
      throw new InvalidDuelRequestException(ex.getMessage());
    }
  }

  private Stance parseStance(String value) {
    if (isBlank(value)) {
      throw new InvalidDuelRequestException("stance is required");
    }
    try {
      return Stance.fromValue(value.trim());
    } catch (IllegalArgumentException ex) {
      throw new InvalidDuelRequestException(ex.getMessage());
    }
  }

  private ModifierScope parseScope(String value) {
    try {
      return ModifierScope.fromValue(value);
    } catch (IllegalArgumentException ex) {
      throw new InvalidDuelRequestException(ex.getMessage());
    }
  }

  private void ensureModerator(String userId) {
    if (!properties.isModerator(userId)) {
      throw new ModeratorAccessDeniedException(userId);
    }
  }

  private void validateContextAndUser(String contextKey, String userId) {
    if (isBlank(contextKey)) {
      throw new InvalidDuelRequestException("contextKey is required");
    }
    if (isBlank(userId)) {
      throw new InvalidDuelRequestException("userId is required");
    }
  }

  private static String resultTag(CancelReason reason) {
    return reason.name().toLowerCase(Locale.ROOT);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
