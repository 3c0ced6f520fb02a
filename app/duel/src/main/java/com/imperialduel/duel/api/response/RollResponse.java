package com.imperialduel.duel.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record RollResponse(
    String participantId,
    String stance,
    String profile,
    List<Integer> dice,
    int keptDie,
    Integer discardedDie,
    int adjacencyModifier,
    int roundModifier,
    int matchModifier,
    int totalModifier,
    int rawValue,
    int finalValue) {}
