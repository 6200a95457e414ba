package com.tofes.analyzer.classify;

/** Mutually exclusive time categories a flight's hours are credited to. */
public enum Role {
  STUDENT,
  PIC,
  SIC,
  /** Single-engine safety pilot time; never counts toward any form total. */
  SAFETY_PILOT_EXCLUDED
}
