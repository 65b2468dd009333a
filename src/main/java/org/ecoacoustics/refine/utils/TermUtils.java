package org.ecoacoustics.refine.utils;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

/**
 * Set of utilities used to interpret raw annotation cell values.
 */
public class TermUtils {

  private TermUtils() {
  }

  /**
   * Left-pad a clock time to the 6 digit HHMMSS form, e.g. "60000" becomes "060000".
   *
   * @param time clock time made of 1 to 6 digits
   *
   * @return padded clock time, or null if the value isn't a clock time made of digits
   */
  @Nullable
  public static String padClockTime(@Nullable String time) {
    if (Strings.isNullOrEmpty(time) || time.length() > Constants.CLOCK_DIGITS
        || !CharMatcher.inRange('0', '9').matchesAllOf(time)) {
      return null;
    }
    return Strings.padStart(time, Constants.CLOCK_DIGITS, '0');
  }

  /**
   * @param time padded HHMMSS clock time
   *
   * @return clock time as an integer comparable across times, e.g. 93000 for "093000"
   */
  public static int clockValue(String time) {
    return Integer.parseInt(time);
  }

  /**
   * Annotators leave cells blank, or R exports write NA, when a species wasn't heard in a chunk.
   *
   * @param cell raw cell value
   *
   * @return true if the cell carries no count
   */
  public static boolean isAbsent(@Nullable String cell) {
    String cleaned = FileUtils.clean(cell);
    return cleaned == null || cleaned.equalsIgnoreCase(Constants.NA);
  }
}
