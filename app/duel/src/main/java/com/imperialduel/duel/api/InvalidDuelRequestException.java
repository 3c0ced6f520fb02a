/*
 * どこで: Duel API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: 構え名の誤りや自分自身への挑戦を 400 へ正規化するため
 */
package com.imperialduel.duel.api;

public class InvalidDuelRequestException extends RuntimeException {
  public InvalidDuelRequestException(String message) {
    super(message);
  }
}
