package org.ecoacoustics.refine.event;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
class ActivityFilterTest {

  private static DetectionEvent event(String site, int day, String time, TimeOfDay tod, String species, int count) {
    return new DetectionEvent(site, LocalDate.of(2022, 1, day), time, "1", tod, null, "Active", species, count);
  }

  /**
   * aaa1 is heard on 3 site dates, bbb1 on 2 (twice on the same one), ccc1 on 1.
   */
  private static List<DetectionEvent> events() {
    return ImmutableList.of(
      event("S1", 1, "060000", TimeOfDay.DAWN, "aaa1", 1),
      event("S1", 1, "170000", TimeOfDay.DUSK, "aaa1", 2),
      event("S1", 2, "060000", TimeOfDay.DAWN, "aaa1", 1),
      event("S2", 1, "060000", TimeOfDay.DAWN, "aaa1", 4),
      event("S1", 1, "060000", TimeOfDay.DAWN, "bbb1", 1),
      event("S1", 1, "070000", TimeOfDay.DAWN, "bbb1", 1),
      event("S2", 3, "160000", TimeOfDay.DUSK, "bbb1", 1),
      event("S3", 1, "060000", TimeOfDay.DAWN, "ccc1", 5));
  }

  @Test
  void countsDistinctSiteDates() {
    assertThat(ActivityFilter.summarize(events(), 1))
      .extracting(SpeciesActivitySummary::getSpeciesCode, SpeciesActivitySummary::getActiveSiteDates,
        SpeciesActivitySummary::isRetained)
      .containsExactly(tuple("aaa1", 3, true), tuple("bbb1", 2, true), tuple("ccc1", 1, false));
  }

  @Test
  void keepsSpeciesStrictlyAboveThreshold() {
    List<DetectionEvent> kept = ActivityFilter.filter(events(), 2);

    assertThat(kept).extracting(DetectionEvent::getSpeciesCode).containsOnly("aaa1");
    assertThat(kept).hasSize(4);
  }

  @Test
  void thresholdZeroKeepsEverySpeciesHeardOnce() {
    assertThat(ActivityFilter.filter(events(), 0)).hasSize(8);
  }

  @Test
  void retainedSetShrinksAsThresholdGrows() {
    List<DetectionEvent> events = events();
    Set<String> previous = null;
    for (int threshold = 0; threshold <= 4; threshold++) {
      Set<String> retained = ActivityFilter.retainedSpecies(events, threshold);
      if (previous != null) {
        assertThat(previous).containsAll(retained);
      }
      previous = retained;
    }
    assertThat(previous).isEmpty();
  }

  @Test
  void isDeterministic() {
    List<DetectionEvent> shuffled = Lists.reverse(events());

    assertThat(ActivityFilter.retainedSpecies(shuffled, 1)).isEqualTo(ActivityFilter.retainedSpecies(events(), 1));
    assertThat(ActivityFilter.filter(events(), 1)).isEqualTo(ActivityFilter.filter(events(), 1));
  }

  @Test
  void zeroCountsDoNotMakeASiteDateActive() {
    List<DetectionEvent> events = ImmutableList.of(
      event("S1", 1, "060000", TimeOfDay.DAWN, "aaa1", 0),
      event("S1", 2, "060000", TimeOfDay.DAWN, "aaa1", 1));

    assertThat(ActivityFilter.summarize(events, 0).get(0).getActiveSiteDates()).isEqualTo(1);
  }

  @Test
  void rejectsNegativeThreshold() {
    assertThatThrownBy(() -> ActivityFilter.filter(events(), -1)).isInstanceOf(IllegalArgumentException.class);
  }
}
