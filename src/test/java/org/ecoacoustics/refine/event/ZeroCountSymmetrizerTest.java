package org.ecoacoustics.refine.event;

import java.time.LocalDate;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
class ZeroCountSymmetrizerTest {

  private static DetectionEvent event(String site, String time, TimeOfDay tod, String species, int count) {
    return new DetectionEvent(site, LocalDate.of(2022, 1, 1), time, "1", tod, HourOfDay.of(time), "Active", species,
      count);
  }

  @Test
  void addsZeroRecordForMissingTimeOfDay() {
    List<DetectionEvent> events = ImmutableList.sortedCopyOf(DetectionEvent.ORDER, ImmutableList.of(
      event("S2", "060000", TimeOfDay.DAWN, "dawn1", 3),
      event("S1", "063000", TimeOfDay.DAWN, "dawn1", 1),
      event("S1", "170000", TimeOfDay.DUSK, "both1", 2),
      event("S1", "070000", TimeOfDay.DAWN, "both1", 1)));

    List<DetectionEvent> symmetric = ZeroCountSymmetrizer.symmetrize(events);

    assertThat(symmetric).hasSize(5);
    assertThat(symmetric)
      .filteredOn(e -> e.getDetectionCount() == 0)
      .extracting(DetectionEvent::getSiteId, DetectionEvent::getStartTime, DetectionEvent::getTimeOfDay,
        DetectionEvent::getSpeciesCode, DetectionEvent::getHourOfDay)
      .containsExactly(tuple("S1", "063000", TimeOfDay.DUSK, "dawn1", null));
  }

  @Test
  void leavesSymmetricDataUntouched() {
    List<DetectionEvent> events = ImmutableList.sortedCopyOf(DetectionEvent.ORDER, ImmutableList.of(
      event("S1", "070000", TimeOfDay.DAWN, "both1", 1),
      event("S1", "170000", TimeOfDay.DUSK, "both1", 2)));

    assertThat(ZeroCountSymmetrizer.symmetrize(events)).isEqualTo(events);
  }

  @Test
  void worksForAnySpeciesInEitherDirection() {
    List<DetectionEvent> events = ImmutableList.of(
      event("S1", "060000", TimeOfDay.DAWN, "aaa1", 1),
      event("S1", "160000", TimeOfDay.DUSK, "bbb1", 1));

    assertThat(ZeroCountSymmetrizer.symmetrize(events))
      .filteredOn(e -> e.getDetectionCount() == 0)
      .extracting(DetectionEvent::getSpeciesCode, DetectionEvent::getTimeOfDay)
      .containsExactlyInAnyOrder(tuple("aaa1", TimeOfDay.DUSK), tuple("bbb1", TimeOfDay.DAWN));
  }
}
