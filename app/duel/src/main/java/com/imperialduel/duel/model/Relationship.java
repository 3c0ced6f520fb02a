/*
 * どこで: Duel ドメインモデル
 * 何を: 2 つの構えの相性とダイスの振り方を定義する
 * なぜ: 有利/不利/互角をロール方式と 1:1 で対応させるため
 */
package com.imperialduel.duel.model;

public enum Relationship {
  ADVANTAGE,
  DISADVANTAGE,
  NEUTRAL;

  /** 相手側から見た相性を返す。 */
  public Relationship inverse() {
    return switch (this) {
      case ADVANTAGE -> DISADVANTAGE;
      case DISADVANTAGE -> ADVANTAGE;
      case NEUTRAL -> NEUTRAL;
    };
  }

  public int diceCount() {
    return this == NEUTRAL ? 1 : 2;
  }
}
