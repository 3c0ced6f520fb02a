package com.imperialduel.duel.repository;

import com.imperialduel.duel.engine.DuplicateMatchException;
import com.imperialduel.duel.engine.Match;
import com.imperialduel.duel.model.MatchState;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryMatchRepository implements MatchRepository {

  private final ConcurrentMap<String, Match> matches = new ConcurrentHashMap<>();

  @Override
  public Match create(String contextKey, Supplier<Match> factory) {
    return matches.compute(
        contextKey,
        (key, existing) -> {
          if (existing != null && !existing.isTerminal()) {
            throw new DuplicateMatchException(key);
          }
          final Match created = Objects.requireNonNull(factory.get(), "factory returned null");
          if (!key.equals(created.contextKey())) {
            throw new IllegalArgumentException(
                "context key mismatch: " + key + " != " + created.contextKey());
          }
          return created;
        });
  }

  @Override
  public Optional<Match> findByContextKey(String contextKey) {
    return Optional.ofNullable(matches.get(contextKey));
  }

  @Override
  public List<Match> findByState(MatchState state) {
    return matches.values().stream().filter(match -> match.state() == state).toList();
  }

  @Override
  public boolean remove(String contextKey) {
    return matches.remove(contextKey) != null;
  }

  @Override
  public long countInProgress() {
    return matches.values().stream().filter(match -> !match.isTerminal()).count();
  }
}
