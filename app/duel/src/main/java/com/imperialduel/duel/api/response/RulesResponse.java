/*
 * どこで: Duel API レスポンス DTO
 * 何を: 構えの相性表とダイスルールを返す
 * なぜ: 表示側がルール説明を自前で持たずに済むようにするため
 */
package com.imperialduel.duel.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record RulesResponse(
    List<String> stances,
    Map<String, List<String>> advantages,
    Map<String, List<String>> disadvantages,
    Map<String, String> dice,
    List<Integer> bestOf,
    int modifierMin,
    int modifierMax) {}
