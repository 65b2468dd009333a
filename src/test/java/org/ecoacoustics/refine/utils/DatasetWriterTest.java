package org.ecoacoustics.refine.utils;

import org.ecoacoustics.refine.event.DetectionEvent;
import org.ecoacoustics.refine.event.HourOfDay;
import org.ecoacoustics.refine.event.TimeOfDay;
import org.ecoacoustics.refine.exception.DatasetWriteException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DatasetWriterTest {

  private static final List<DetectionEvent> EVENTS = ImmutableList.of(
    new DetectionEvent("S1", LocalDate.of(2022, 1, 1), "060000", "1", TimeOfDay.DAWN, HourOfDay.AM_6_7, "Active",
      "xx1", 3),
    new DetectionEvent("S1", LocalDate.of(2022, 1, 1), "120000", "2", TimeOfDay.DUSK, null, "Passive", "yy1", 1));

  @TempDir
  Path tempDir;

  @Test
  void writesHeaderAndRowsInOrder() throws IOException {
    File out = tempDir.resolve("datasubsets/detection-events.csv").toFile();

    DatasetWriter.write(EVENTS, out);

    List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
    assertThat(lines).containsExactly(
      "site_id,date,start_time,split_index,time_of_day,restoration_type,hour_of_day,species_code,detection_count",
      "S1,2022-01-01,060000,1,dawn,Active,6AM-7AM,xx1,3",
      "S1,2022-01-01,120000,2,dusk,Passive,,yy1,1");
    assertThat(tempDir.resolve("datasubsets").toFile().list()).containsExactly("detection-events.csv");
  }

  @Test
  void headerMatchesOutputColumns() {
    assertThat(DatasetWriter.getHeader()).containsExactly("site_id", "date", "start_time", "split_index",
      "time_of_day", "restoration_type", "hour_of_day", "species_code", "detection_count");
  }

  @Test
  void writesIdenticalBytesForIdenticalEvents() throws IOException {
    File first = tempDir.resolve("first.csv").toFile();
    File second = tempDir.resolve("second.csv").toFile();

    DatasetWriter.write(EVENTS, first);
    DatasetWriter.write(EVENTS, second);

    assertThat(Files.readAllBytes(first.toPath())).isEqualTo(Files.readAllBytes(second.toPath()));
  }

  @Test
  void replacesExistingFile() throws IOException {
    File out = tempDir.resolve("events.csv").toFile();
    Files.write(out.toPath(), "stale".getBytes(StandardCharsets.UTF_8));

    DatasetWriter.write(EVENTS.subList(0, 1), out);

    assertThat(Files.readAllLines(out.toPath(), StandardCharsets.UTF_8)).hasSize(2);
  }

  @Test
  void failsWithDestinationWhenNotWritable() throws IOException {
    File blocker = tempDir.resolve("blocker").toFile();
    Files.write(blocker.toPath(), new byte[0]);
    File out = new File(blocker, "events.csv");

    assertThatThrownBy(() -> DatasetWriter.write(EVENTS, out))
      .isInstanceOf(DatasetWriteException.class)
      .hasMessageContaining(out.getAbsolutePath());
    assertThatThrownBy(() -> DatasetWriter.write(EVENTS, tempDir.toFile()))
      .isInstanceOf(DatasetWriteException.class)
      .hasMessageContaining("directory");
  }
}
