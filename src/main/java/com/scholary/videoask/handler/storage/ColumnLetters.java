package com.scholary.videoask.handler.storage;

import java.util.Locale;
import java.util.regex.Pattern;

/** A1-notation column letter helpers. */
public final class ColumnLetters {

  private static final Pattern LETTERS = Pattern.compile("[A-Z]{1,3}");

  private ColumnLetters() {}

  /**
   * Convert a 1-based column index to letters: 1 is A, 26 is Z, 27 is AA.
   *
   * @throws IllegalArgumentException for indexes below 1
   */
  public static String fromIndex(int index) {
    if (index < 1) {
      throw new IllegalArgumentException("Column index must be positive: " + index);
    }
    StringBuilder letters = new StringBuilder();
    int remaining = index;
    while (remaining > 0) {
      int digit = (remaining - 1) % 26;
      letters.insert(0, (char) ('A' + digit));
      remaining = (remaining - 1) / 26;
    }
    return letters.toString();
  }

  /**
   * Normalise a configured column: letters are upper-cased, numeric values are treated as 1-based
   * indexes.
   *
   * @throws IllegalArgumentException if the value is neither
   */
  public static String normalize(String column) {
    if (column == null || column.isBlank()) {
      throw new IllegalArgumentException("Column is blank");
    }
    String value = column.trim().toUpperCase(Locale.ROOT);
    if (value.chars().allMatch(Character::isDigit)) {
      return fromIndex(Integer.parseInt(value));
    }
    if (!LETTERS.matcher(value).matches()) {
      throw new IllegalArgumentException("Not a column letter: " + column);
    }
    return value;
  }
}
