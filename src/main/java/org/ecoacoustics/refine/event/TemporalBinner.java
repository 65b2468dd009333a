package org.ecoacoustics.refine.event;

import org.ecoacoustics.refine.utils.TermUtils;

import java.util.List;
import javax.annotation.Nullable;
import javax.validation.constraints.NotNull;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns every detection event its canonical hour of day bucket.
 */
public class TemporalBinner {

  private static final Logger LOG = LoggerFactory.getLogger(TemporalBinner.class);

  private TemporalBinner() {
  }

  /**
   * Bucket a raw clock time. Times outside every bucket, or that aren't clock times at all, have no bucket; such
   * events are excluded from hour of day analyses downstream but stay in the table.
   *
   * @param startTime HHMMSS clock time, possibly missing its leading zeros
   *
   * @return bucket, or null
   */
  @Nullable
  public static HourOfDay bucketOf(@Nullable String startTime) {
    String padded = TermUtils.padClockTime(startTime);
    return padded == null ? null : HourOfDay.of(padded);
  }

  /**
   * @param events detection events
   *
   * @return copies of the events with a 6 digit start time and their hour of day bucket set, in the same order
   */
  @NotNull
  public static ImmutableList<DetectionEvent> bin(List<DetectionEvent> events) {
    ImmutableList.Builder<DetectionEvent> binned = ImmutableList.builder();
    int unbucketed = 0;
    for (DetectionEvent event : events) {
      String padded = TermUtils.padClockTime(event.getStartTime());
      DetectionEvent normalized = padded == null ? event : event.withStartTime(padded);
      HourOfDay bucket = padded == null ? null : HourOfDay.of(padded);
      if (bucket == null) {
        unbucketed++;
      }
      binned.add(normalized.withHourOfDay(bucket));
    }
    if (unbucketed > 0) {
      LOG.warn(unbucketed + " of " + events.size() + " events start outside every hour of day bucket;"
               + " their hour_of_day is left empty");
    }
    return binned.build();
  }
}
