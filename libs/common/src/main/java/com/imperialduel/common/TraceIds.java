package com.imperialduel.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 値が空なら新しい ID を払い出し、そうでなければそのまま返す。 */
  public static String orNew(String candidate) {
    return candidate == null || candidate.isBlank() ? newTraceId() : candidate;
  }
}
