package com.tofes.analyzer.classify;

/** Boolean facts derived while classifying a flight. */
public enum FlightFlag {
  NIGHT,
  CROSS_COUNTRY,
  COMPLEX,
  INSTRUMENT_ACTUAL,
  INSTRUMENT_SIMULATED,
  TRAINING_DEVICE,
  SOLO,
  UNDER_INSTRUCTION,
  SAFETY_PILOT
}
