package org.ecoacoustics.refine.event;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.validation.constraints.NotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps only species that vocalized often enough to be analyzed. This is a fixed inclusion policy: a species is kept
 * when the number of distinct site and date combinations it was detected on is strictly greater than the minimum
 * occurrence threshold.
 */
public class ActivityFilter {

  private static final Logger LOG = LoggerFactory.getLogger(ActivityFilter.class);

  public static final int DEFAULT_MINIMUM_OCCURRENCE_THRESHOLD = 20;

  private ActivityFilter() {
  }

  /**
   * Count, per species, the distinct (site, date) pairs whose summed detections on that date are nonzero, across
   * both times of day and every chunk.
   *
   * @param events detection events
   * @param threshold minimum occurrence threshold
   *
   * @return one summary per species, ordered by species code
   */
  @NotNull
  public static ImmutableList<SpeciesActivitySummary> summarize(List<DetectionEvent> events, int threshold) {
    // species -> (site, date) -> summed count
    Map<String, Map<Pair<String, LocalDate>, Integer>> totals = Maps.newTreeMap();
    for (DetectionEvent event : events) {
      Map<Pair<String, LocalDate>, Integer> perSiteDate = totals.get(event.getSpeciesCode());
      if (perSiteDate == null) {
        perSiteDate = Maps.newHashMap();
        totals.put(event.getSpeciesCode(), perSiteDate);
      }
      Pair<String, LocalDate> siteDate = Pair.of(event.getSiteId(), event.getDate());
      Integer previous = perSiteDate.get(siteDate);
      perSiteDate.put(siteDate, (previous == null ? 0 : previous) + event.getDetectionCount());
    }

    ImmutableList.Builder<SpeciesActivitySummary> summaries = ImmutableList.builder();
    for (Map.Entry<String, Map<Pair<String, LocalDate>, Integer>> species : totals.entrySet()) {
      int active = 0;
      for (int total : species.getValue().values()) {
        if (total > 0) {
          active++;
        }
      }
      summaries.add(new SpeciesActivitySummary(species.getKey(), active, active > threshold));
    }
    return summaries.build();
  }

  /**
   * @param events detection events
   * @param threshold minimum occurrence threshold
   *
   * @return codes of the species with more active site and date combinations than the threshold
   */
  @NotNull
  public static ImmutableSet<String> retainedSpecies(List<DetectionEvent> events, int threshold) {
    ImmutableSet.Builder<String> retained = ImmutableSet.builder();
    for (SpeciesActivitySummary summary : summarize(events, threshold)) {
      if (summary.isRetained()) {
        retained.add(summary.getSpeciesCode());
      }
    }
    return retained.build();
  }

  /**
   * Drop every event of a species that doesn't pass the threshold.
   *
   * @param events detection events
   * @param threshold minimum occurrence threshold, must not be negative
   *
   * @return events of the retained species, in the same order
   */
  @NotNull
  public static ImmutableList<DetectionEvent> filter(List<DetectionEvent> events, int threshold) {
    if (threshold < 0) {
      throw new IllegalArgumentException("Minimum occurrence threshold must not be negative: " + threshold);
    }
    List<SpeciesActivitySummary> summaries = summarize(events, threshold);
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    int excluded = 0;
    for (SpeciesActivitySummary summary : summaries) {
      if (summary.isRetained()) {
        builder.add(summary.getSpeciesCode());
        LOG.debug("Retaining " + summary.getSpeciesCode() + ": active on " + summary.getActiveSiteDates()
                  + " site dates");
      } else {
        excluded++;
        LOG.info("Excluding " + summary.getSpeciesCode() + ": active on " + summary.getActiveSiteDates()
                 + " site dates, threshold is " + threshold);
      }
    }
    Set<String> retained = builder.build();

    ImmutableList.Builder<DetectionEvent> kept = ImmutableList.builder();
    int keptEvents = 0;
    for (DetectionEvent event : events) {
      if (retained.contains(event.getSpeciesCode())) {
        kept.add(event);
        keptEvents++;
      }
    }
    LOG.info("Retained " + retained.size() + " of " + summaries.size() + " species (" + excluded + " excluded), "
             + keptEvents + " of " + events.size() + " events.");
    return kept.build();
  }
}
