/*
 * どこで: Duel Repository 層
 * 何を: コンテキストキー (チャンネル) ごとの対戦の保管を抽象化する
 * なぜ: 「1 コンテキストにつき進行中の対戦は 1 つ」という制約を暗黙のグローバル状態なしで守るため
 */
package com.imperialduel.duel.repository;

import com.imperialduel.duel.engine.Match;
import com.imperialduel.duel.model.MatchState;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

public interface MatchRepository {

  /**
   * 役割: コンテキストに新しい対戦を登録する。
   * 動作: 終端状態の対戦が残っていれば置き換え、進行中の対戦があれば DuplicateMatchException を送出する。判定と登録は原子的に行う。
   * 前提: factory は contextKey と同じキーを持つ Match を返すこと。
   */
  Match create(String contextKey, Supplier<Match> factory);

  /** 役割: コンテキストの対戦を取得する。 動作: 終端状態の対戦も置き換えられるまでは返す。 */
  Optional<Match> findByContextKey(String contextKey);

  /** 役割: 指定状態の対戦一覧を返す。 動作: 呼び出し時点のコピーを返す。 */
  List<Match> findByState(MatchState state);

  /** 役割: 対戦を破棄する。 動作: 存在していた場合のみ true を返す。 */
  boolean remove(String contextKey);

  /** 役割: 終端状態でない対戦の件数を返す。 */
  long countInProgress();
}
