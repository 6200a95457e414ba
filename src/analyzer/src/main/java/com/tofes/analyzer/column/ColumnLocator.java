package com.tofes.analyzer.column;

/**
 * Points at a source column either by header name or by 0-based position.
 *
 * @param name header name, {@code null} for positional locators
 * @param index 0-based column index, {@code null} for named locators
 */
public record ColumnLocator(String name, Integer index) {

  public ColumnLocator {
    if ((name == null) == (index == null)) {
      throw new IllegalArgumentException("exactly one of name or index must be set");
    }
    if (index != null && index < 0) {
      throw new IllegalArgumentException("column index must be >= 0");
    }
  }

  public static ColumnLocator byName(String name) {
    return new ColumnLocator(name, null);
  }

  public static ColumnLocator byIndex(int index) {
    return new ColumnLocator(null, index);
  }

  /**
   * Parses the textual form used in configuration: all digits is an index, anything else a name.
   *
   * @param raw locator text
   * @return parsed locator
   */
  public static ColumnLocator parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("column locator must not be blank");
    }
    String value = raw.trim();
    if (value.chars().allMatch(Character::isDigit)) {
      try {
        return byIndex(Integer.parseInt(value));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("column index '" + value + "' is out of range");
      }
    }
    return byName(value);
  }

  public boolean isPositional() {
    return index != null;
  }

  @Override
  public String toString() {
    return isPositional() ? "#" + index : "'" + name + "'";
  }
}
