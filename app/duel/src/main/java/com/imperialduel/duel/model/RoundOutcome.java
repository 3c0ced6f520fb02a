package com.imperialduel.duel.model;

public enum RoundOutcome {
  FIRST_PARTICIPANT,
  SECOND_PARTICIPANT,
  TIE
}
