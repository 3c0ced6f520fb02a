/*
 * どこで: Duel エンジン
 * 何を: 参加者ごとのラウンド補正/対戦補正を保持する
 * なぜ: モデレーターが設定した補正をラウンド解決時に参照し、ラウンド終了で確実に消すため
 */
package com.imperialduel.duel.engine;

import com.imperialduel.duel.model.ActiveModifiers;
import com.imperialduel.duel.model.ModifierScope;
import java.util.HashMap;
import java.util.Map;

public final class ModifierRegistry {

  public static final int MIN_VALUE = -3;
  public static final int MAX_VALUE = 3;

  private final Map<String, Integer> roundModifiers = new HashMap<>();
  private final Map<String, Integer> matchModifiers = new HashMap<>();

  public void setRoundModifier(String participantId, int value) {
    set(ModifierScope.ROUND, participantId, value);
  }

  public void setMatchModifier(String participantId, int value) {
    set(ModifierScope.MATCH, participantId, value);
  }

  /**
   * 役割: 補正値を設定する。
   * 動作: 0 は該当エントリの削除として扱う。範囲外は ModifierRangeException を送出し、状態を変えない。
   * 前提: 設定タイミングの検証は Match 側で済んでいること。
   */
  public void set(ModifierScope scope, String participantId, int value) {
    validateRange(value);
    final Map<String, Integer> target = scope == ModifierScope.ROUND ? roundModifiers : matchModifiers;
    if (value == 0) {
      target.remove(participantId);
    } else {
      target.put(participantId, value);
    }
  }

  public ActiveModifiers getActive(String participantId) {
    final Integer round = roundModifiers.get(participantId);
    final Integer match = matchModifiers.get(participantId);
    if (round == null && match == null) {
      return ActiveModifiers.NONE;
    }
    return new ActiveModifiers(
        round == null ? 0 : round, match == null ? 0 : match, round != null, match != null);
  }

  public void clearRoundModifiers() {
    roundModifiers.clear();
  }

  public void clearAll() {
    roundModifiers.clear();
    matchModifiers.clear();
  }

  static void validateRange(int value) {
    if (value < MIN_VALUE || value > MAX_VALUE) {
      throw new ModifierRangeException(
          "modifier must be between " + MIN_VALUE + " and " + MAX_VALUE + ": " + value);
    }
  }
}
