package org.ecoacoustics.refine.event;

import javax.annotation.Nullable;

/**
 * Canonical hour-long buckets covering the dawn and dusk recording windows. The last bucket of each window also
 * takes the recordings starting exactly on the hour that closes it.
 */
public enum HourOfDay {
  AM_6_7("6AM-7AM", new ClockWindow("060000", "070000", false)),
  AM_7_8("7AM-8AM", new ClockWindow("070000", "080000", false)),
  AM_8_9("8AM-9AM", new ClockWindow("080000", "090000", false)),
  AM_9_10("9AM-10AM", new ClockWindow("090000", "100000", true)),
  PM_4_5("4PM-5PM", new ClockWindow("160000", "170000", false)),
  PM_5_6("5PM-6PM", new ClockWindow("170000", "180000", false)),
  PM_6_7("6PM-7PM", new ClockWindow("180000", "190000", true));

  private final String label;
  private final ClockWindow window;

  HourOfDay(String label, ClockWindow window) {
    this.label = label;
    this.window = window;
  }

  public String getLabel() {
    return label;
  }

  /**
   * @param time padded HHMMSS clock time
   *
   * @return bucket containing the time, or null if it falls outside every bucket
   */
  @Nullable
  public static HourOfDay of(String time) {
    for (HourOfDay bucket : values()) {
      if (bucket.window.contains(time)) {
        return bucket;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return label;
  }
}
