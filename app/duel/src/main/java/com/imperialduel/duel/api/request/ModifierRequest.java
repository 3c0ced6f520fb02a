/*
 * どこで: Duel API リクエスト DTO
 * 何を: モデレーターによる補正設定の入力を定義する
 * なぜ: 範囲チェックはエンジン側で行い、ここでは必須項目のみを検証するため
 */
package com.imperialduel.duel.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ModifierRequest(
    @NotBlank String participantId, @NotBlank String scope, @NotNull Integer value) {}
