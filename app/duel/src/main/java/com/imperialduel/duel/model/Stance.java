/*
 * どこで: Duel ドメインモデル
 * 何を: 六角形上に時計回りで並ぶ 6 つの構えを定義する
 * なぜ: 構えの入力値を列挙型で固定し、相性計算を網羅的に扱うため
 */
package com.imperialduel.duel.model;

public enum Stance {
  BAGR("Bagr"),
  RADAE("Radae"),
  DARDA("Darda"),
  TIGR("Tigr"),
  RIPOSJE("Riposje"),
  TORTAD("Tortad");

  private final String value;

  Stance(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** 時計回りの位置 (0..5)。 */
  public int position() {
    return ordinal();
  }

  /**
   * 役割: API で受け取った構え名を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: なし。null は未対応値として扱う。
   */
  public static Stance fromValue(String stance) {
    for (Stance candidate : values()) {
      if (candidate.value.equalsIgnoreCase(stance)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported stance: " + stance);
  }
}
