package com.imperialduel.duel.model;

public enum CancelReason {
  WITHDRAWN,
  CANCELLED_BY_PARTICIPANT,
  FORCE_ENDED,
  EXPIRED
}
