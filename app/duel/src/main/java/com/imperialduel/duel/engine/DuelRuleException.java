/*
 * どこで: Duel エンジン
 * 何を: 対戦ルール違反の基底例外を定義する
 * なぜ: 呼び出し側がコード値で失敗種別を判定できるようにするため
 */
package com.imperialduel.duel.engine;

public abstract class DuelRuleException extends RuntimeException {

  private final String code;

  protected DuelRuleException(String code, String message) {
    super(message);
    this.code = code;
  }

  public String code() {
    return code;
  }
}
