package com.imperialduel.duel.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class DuelMetrics {

  private final MeterRegistry meterRegistry;
  private final Counter challengeCounter;
  private final AtomicLong activeMatches = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> roundCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> finishedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rejectedCounters = new ConcurrentHashMap<>();

  public DuelMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.challengeCounter =
        Counter.builder("duel.challenge.total")
            .description("Challenges issued")
            .register(meterRegistry);
    Gauge.builder("duel.match.active", activeMatches, AtomicLong::get)
        .description("Matches that are pending or in progress")
        .register(meterRegistry);
  }

  public void recordChallenge() {
    challengeCounter.increment();
  }

  public void recordRound(String outcome) {
    roundCounters.computeIfAbsent(outcome, this::registerRoundCounter).increment();
  }

  public void recordMatchFinished(String result) {
    finishedCounters.computeIfAbsent(result, this::registerFinishedCounter).increment();
  }

  public void recordRejectedAction(String code) {
    rejectedCounters.computeIfAbsent(code, this::registerRejectedCounter).increment();
  }

  public void updateActiveMatches(long count) {
    activeMatches.set(Math.max(0, count));
  }

  private Counter registerRoundCounter(String outcome) {
    return Counter.builder("duel.round.total")
        .tags(Tags.of("outcome", outcome))
        .register(meterRegistry);
  }

  private Counter registerFinishedCounter(String result) {
    return Counter.builder("duel.match.finished.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerRejectedCounter(String code) {
    return Counter.builder("duel.action.rejected.total")
        .tags(Tags.of("code", code))
        .register(meterRegistry);
  }
}
