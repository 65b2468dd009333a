package org.ecoacoustics.refine.event;

import org.ecoacoustics.refine.exception.ConfigurationException;
import org.ecoacoustics.refine.utils.TermUtils;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Splitter;

/**
 * Range of HHMMSS clock times. The start is always inclusive; the end is inclusive only when requested.
 */
public final class ClockWindow {

  private static final Splitter RANGE_SPLITTER = Splitter.on('-').trimResults();

  private final String start;
  private final String end;
  private final boolean endInclusive;

  public ClockWindow(String start, String end, boolean endInclusive) {
    this.start = Objects.requireNonNull(TermUtils.padClockTime(start), "start must be a clock time");
    this.end = Objects.requireNonNull(TermUtils.padClockTime(end), "end must be a clock time");
    this.endInclusive = endInclusive;
    if (TermUtils.clockValue(this.start) > TermUtils.clockValue(this.end)) {
      throw new IllegalArgumentException("Window start " + start + " is after its end " + end);
    }
  }

  /**
   * Parse a closed window written as "HHMMSS-HHMMSS", e.g. "060000-100000".
   *
   * @param range window definition
   *
   * @return closed clock window
   *
   * @throws ConfigurationException if the definition isn't two clock times in order
   */
  public static ClockWindow parseClosed(String range) throws ConfigurationException {
    List<String> parts = RANGE_SPLITTER.splitToList(range);
    if (parts.size() != 2 || TermUtils.padClockTime(parts.get(0)) == null
        || TermUtils.padClockTime(parts.get(1)) == null) {
      throw new ConfigurationException("Clock window must look like HHMMSS-HHMMSS, got: " + range);
    }
    try {
      return new ClockWindow(parts.get(0), parts.get(1), true);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid clock window " + range, e);
    }
  }

  /**
   * @param time padded HHMMSS clock time
   *
   * @return true if the time falls inside this window
   */
  public boolean contains(String time) {
    int value = TermUtils.clockValue(time);
    int upper = TermUtils.clockValue(end);
    return value >= TermUtils.clockValue(start) && (endInclusive ? value <= upper : value < upper);
  }

  public String getStart() {
    return start;
  }

  public String getEnd() {
    return end;
  }

  public boolean isEndInclusive() {
    return endInclusive;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ClockWindow)) {
      return false;
    }
    ClockWindow that = (ClockWindow) o;
    return endInclusive == that.endInclusive && start.equals(that.start) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end, endInclusive);
  }

  @Override
  public String toString() {
    return "[" + start + "," + end + (endInclusive ? "]" : ")");
  }
}
