package com.tofes.analyzer.classify;

import java.math.BigDecimal;

/**
 * Hours split into day and night portions.
 *
 * @param day day hours
 * @param night night hours
 */
public record DayNight(BigDecimal day, BigDecimal night) {
  public static final DayNight ZERO = new DayNight(BigDecimal.ZERO, BigDecimal.ZERO);

  public BigDecimal total() {
    return day.add(night);
  }

  public DayNight plus(DayNight other) {
    return new DayNight(day.add(other.day), night.add(other.night));
  }
}
