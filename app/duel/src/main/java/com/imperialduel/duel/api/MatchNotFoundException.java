/*
 * どこで: Duel API
 * 何を: コンテキストに対戦が無いことを表現する
 * なぜ: status/accept などの 404 応答へ変換するため
 */
package com.imperialduel.duel.api;

public class MatchNotFoundException extends RuntimeException {
  public MatchNotFoundException(String contextKey) {
    super("no match in context: " + contextKey);
  }
}
