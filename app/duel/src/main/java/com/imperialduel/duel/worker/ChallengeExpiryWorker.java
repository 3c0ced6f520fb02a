package com.imperialduel.duel.worker;

import com.imperialduel.duel.service.DuelMetrics;
import com.imperialduel.duel.service.DuelService;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 受諾されないまま challenge-ttl を過ぎた挑戦を定期的に EXPIRED で中止する。 */
@Component
@ConditionalOnProperty(name = "duel.expiry-enabled", havingValue = "true", matchIfMissing = true)
public class ChallengeExpiryWorker {

  private static final Logger logger = LoggerFactory.getLogger(ChallengeExpiryWorker.class);

  private final DuelService duelService;
  private final DuelMetrics metrics;
  private final Clock clock;

  public ChallengeExpiryWorker(DuelService duelService, DuelMetrics metrics, Clock clock) {
    this.duelService = duelService;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${duel.expiry-poll-interval}")
  public void run() {
    try {
      final int expired = duelService.expirePendingChallenges(Instant.now(clock));
      if (expired > 0) {
        logger.info("expired pending challenges count={}", expired);
      }
      metrics.updateActiveMatches(duelService.countInProgress());
    } catch (RuntimeException ex) {
      logger.warn("challenge expiry loop failed", ex);
    }
  }
}
