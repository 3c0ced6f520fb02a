package com.imperialduel.duel.model;

public enum Adjacency {
  ADJACENT(1),
  OPPOSITE(-1),
  OTHER(0);

  private final int modifier;

  Adjacency(int modifier) {
    this.modifier = modifier;
  }

  /** 隣接ルール有効時に両者のロールへ加算する値。 */
  public int modifier() {
    return modifier;
  }
}
