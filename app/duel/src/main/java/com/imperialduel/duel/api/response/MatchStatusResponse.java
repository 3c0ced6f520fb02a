/*
 * どこで: Duel API レスポンス DTO
 * 何を: 対戦状態の応答を定義する
 * なぜ: 得点・段階・待ち参加者・補正を 1 つの構造で返すため
 */
package com.imperialduel.duel.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record MatchStatusResponse(
    String contextKey,
    String state,
    String phase,
    int round,
    int bestOf,
    int winThreshold,
    boolean noRepeat,
    boolean adjacencyModifier,
    boolean baitSwitch,
    List<ParticipantStatusResponse> participants,
    List<String> pendingParticipantIds,
    String winnerId,
    String cancelReason,
    int roundsPlayed) {}
