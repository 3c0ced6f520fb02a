package com.imperialduel.duel.model;

/**
 * 参加者 1 人分の補正値。roundSet / matchSet は該当スコープの補正が登録されているかを表す。0 の設定は登録の削除なので false になる。
 */
public record ActiveModifiers(int round, int match, boolean roundSet, boolean matchSet) {

  public static final ActiveModifiers NONE = new ActiveModifiers(0, 0, false, false);

  public int total() {
    return round + match;
  }
}
