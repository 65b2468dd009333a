package org.ecoacoustics.refine.event;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import javax.validation.constraints.NotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives every species a record in both times of day. A species only detected at dawn (or only at dusk) gets one
 * zero-count placeholder in the other window, so per time of day comparisons see an explicit zero instead of a
 * missing species.
 * <p>
 * Placeholders carry no real recording identity. Their site, date, start time and split index are borrowed from an
 * event of the other time of day (so a dusk placeholder can start at 060000), and only species code, time of day and
 * the zero count are meaningful. Consumers joining on recording identity should drop zero-count rows first.
 */
public class ZeroCountSymmetrizer {

  private static final Logger LOG = LoggerFactory.getLogger(ZeroCountSymmetrizer.class);

  private ZeroCountSymmetrizer() {
  }

  /**
   * The placeholder copies the recording identity of the species' first event (in output order) from the window it
   * was detected in, switches the time of day, and has no hour of day bucket.
   *
   * @param events detection events, sorted by {@link DetectionEvent#ORDER}
   *
   * @return events plus placeholders, sorted by {@link DetectionEvent#ORDER}
   */
  @NotNull
  public static ImmutableList<DetectionEvent> symmetrize(List<DetectionEvent> events) {
    Map<String, DetectionEvent> firstNonzero = Maps.newTreeMap();
    Map<String, EnumSet<TimeOfDay>> windows = Maps.newHashMap();
    for (DetectionEvent event : events) {
      EnumSet<TimeOfDay> seen = windows.get(event.getSpeciesCode());
      if (seen == null) {
        seen = EnumSet.noneOf(TimeOfDay.class);
        windows.put(event.getSpeciesCode(), seen);
      }
      seen.add(event.getTimeOfDay());
      if (event.getDetectionCount() > 0 && !firstNonzero.containsKey(event.getSpeciesCode())) {
        firstNonzero.put(event.getSpeciesCode(), event);
      }
    }

    List<DetectionEvent> symmetric = Lists.newArrayList(events);
    for (DetectionEvent first : firstNonzero.values()) {
      EnumSet<TimeOfDay> seen = windows.get(first.getSpeciesCode());
      for (TimeOfDay missing : EnumSet.complementOf(seen)) {
        DetectionEvent placeholder = new DetectionEvent(first.getSiteId(), first.getDate(), first.getStartTime(),
          first.getSplitIndex(), missing, null, first.getRestorationType(), first.getSpeciesCode(), 0);
        symmetric.add(placeholder);
        LOG.info("Adding zero " + missing + " record for " + first.getSpeciesCode() + ", only detected at "
                 + first.getTimeOfDay());
      }
    }
    return ImmutableList.sortedCopyOf(DetectionEvent.ORDER, symmetric);
  }
}
