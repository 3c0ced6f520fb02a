/*
 * どこで: Duel API レスポンス DTO
 * 何を: Pick API の応答を定義する
 * なぜ: 1 人目の選択は受付のみ、2 人目の選択は解決結果付きで返すため
 */
package com.imperialduel.duel.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PickResponse(String status, String pickedStance, RoundResultResponse round) {}
