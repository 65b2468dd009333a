package org.ecoacoustics.refine.annotation;

import org.ecoacoustics.refine.event.ClockWindow;
import org.ecoacoustics.refine.event.TimeOfDay;
import org.ecoacoustics.refine.exception.FilenameFormatException;
import org.ecoacoustics.refine.exception.RefineException;
import org.ecoacoustics.refine.exception.SchemaException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.ByteSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AnnotationLoaderTest {

  private static final String HEADER =
    "Filename,X1,X2,Restoration.Type..Benchmark.Active.Passive.,Time..Morning.Evening.Night.,Notes\n";
  private static final ClockWindow DAWN = new ClockWindow("060000", "100000", true);
  private static final Set<String> METADATA = ImmutableSet.of("Notes", "Observer");

  private static ByteSource csv(String content) {
    return ByteSource.wrap(content.getBytes(StandardCharsets.UTF_8));
  }

  private static AnnotationTable load(Map<String, ByteSource> sources) throws IOException, RefineException {
    return AnnotationLoader.load(TimeOfDay.DAWN, DAWN, METADATA, sources);
  }

  @Test
  void concatenatesSeasonsAndDropsMetadataColumns() throws IOException, RefineException {
    AnnotationTable table = load(ImmutableMap.of(
      "summer", csv(HEADER + "S1_20220101_060000_1,3,,Active,Morning,heard twice\n"),
      "winter", csv(HEADER + "S2_20220705_070000_2,0,1,Passive,Morning,\n")));

    assertThat(table.getTimeOfDay()).isEqualTo(TimeOfDay.DAWN);
    assertThat(table.getSpeciesColumns()).containsExactly("X1", "X2");
    assertThat(table.getRows()).hasSize(2);

    AnnotationRow first = table.getRows().get(0);
    assertThat(first.getSource()).isEqualTo("summer");
    assertThat(first.getLine()).isEqualTo(1);
    assertThat(first.getRecording().getSiteId()).isEqualTo("S1");
    assertThat(first.getRestorationType()).isEqualTo("Active");
    assertThat(first.getSpeciesCells()).containsOnlyKeys("X1", "X2");
    assertThat(first.getSpeciesCells()).containsEntry("X1", "3").containsEntry("X2", "");

    AnnotationRow second = table.getRows().get(1);
    assertThat(second.getSource()).isEqualTo("winter");
    assertThat(second.getRecording().getSiteId()).isEqualTo("S2");
  }

  @Test
  void acceptsSameColumnsInAnotherOrder() throws IOException, RefineException {
    AnnotationTable table = load(ImmutableMap.of(
      "summer", csv("Filename,X1,X2\nS1_20220101_060000_1,1,2\n"),
      "winter", csv("X2,Filename,X1\n5,S1_20220702_060000_1,4\n")));

    assertThat(table.getRows().get(1).getSpeciesCells()).containsEntry("X1", "4").containsEntry("X2", "5");
  }

  @Test
  void rejectsColumnMismatchNamingTheColumns() {
    assertThatThrownBy(() -> load(ImmutableMap.of(
      "summer", csv("Filename,X1,X2\nS1_20220101_060000_1,1,2\n"),
      "winter", csv("Filename,X1,X3\nS1_20220702_060000_1,1,2\n"))))
      .isInstanceOf(SchemaException.class)
      .hasMessageContaining("winter")
      .hasMessageContaining("missing [X2]")
      .hasMessageContaining("extra [X3]");
  }

  @Test
  void provenanceWinsOverClockTime() throws IOException, RefineException {
    AnnotationTable table = load(ImmutableMap.of(
      "summer", csv("Filename,X1,Time..Morning.Evening.Night.\nS1_20220101_180000_1,1,Evening\n")));

    assertThat(table.getRows().get(0).getTimeOfDay()).isEqualTo(TimeOfDay.DAWN);
    assertThat(table.getRowsOutsideWindow()).isEqualTo(1);
    assertThat(table.getSpeciesColumns()).containsExactly("X1");
  }

  @Test
  void rejectsMalformedFilename() {
    assertThatThrownBy(() -> load(ImmutableMap.of(
      "summer", csv("Filename,X1\nS1-20220101-060000-1,1\n"))))
      .isInstanceOf(FilenameFormatException.class)
      .hasMessageContaining("S1-20220101-060000-1");
  }

  @Test
  void repairsShortRowsAndUnnamedColumns() throws IOException, RefineException {
    AnnotationTable table = load(ImmutableMap.of(
      "summer", csv("Filename,X1,X2,\nS1_20220101_060000_1,2\n")));

    assertThat(table.getSpeciesColumns()).containsExactly("X1", "X2");
    assertThat(table.getRows().get(0).getSpeciesCells()).containsEntry("X1", "2").containsEntry("X2", "");
  }

  @Test
  void rejectsUnnamedColumnHoldingCounts() {
    assertThatThrownBy(() -> load(ImmutableMap.of(
      "summer", csv("Filename,X1,\nS1_20220101_060000_1,1,5\n"))))
      .isInstanceOf(SchemaException.class)
      .hasMessageContaining("Unnamed column #3")
      .hasMessageContaining("summer")
      .hasMessageContaining("line 1");
  }

  @Test
  void dropsUnnamedColumnHoldingOnlyAbsentCells() throws IOException, RefineException {
    AnnotationTable table = load(ImmutableMap.of(
      "summer", csv("Filename,X1,\nS1_20220101_060000_1,1,NA\nS1_20220101_060000_2,2, \n")));

    assertThat(table.getSpeciesColumns()).containsExactly("X1");
    assertThat(table.getRows()).hasSize(2);
  }

  @Test
  void skipsBlankRows() throws IOException, RefineException {
    AnnotationTable table = load(ImmutableMap.of(
      "summer", csv("Filename,X1,X2\nS1_20220101_060000_1,1,2\n,,\n  , ,\nS1_20220101_060000_2,3,\n")));

    assertThat(table.getRows()).hasSize(2);
    assertThat(table.getRows().get(1).getLine()).isEqualTo(4);
    assertThat(table.getRows().get(1).getSpeciesCells()).containsEntry("X1", "3");
  }

  @Test
  void rejectsRowsLongerThanHeader() {
    assertThatThrownBy(() -> load(ImmutableMap.of(
      "summer", csv("Filename,X1\nS1_20220101_060000_1,2,7\n"))))
      .isInstanceOf(SchemaException.class)
      .hasMessageContaining("Line 1");
  }

  @Test
  void rejectsDuplicateAndMissingFilenameColumns() {
    assertThatThrownBy(() -> load(ImmutableMap.of("summer", csv("Filename,X1,X1\n"))))
      .isInstanceOf(SchemaException.class)
      .hasMessageContaining("Duplicate column X1");
    assertThatThrownBy(() -> load(ImmutableMap.of("summer", csv("File,X1\n"))))
      .isInstanceOf(SchemaException.class)
      .hasMessageContaining("Filename");
  }

  @Test
  void rejectsEmptySources() {
    assertThatThrownBy(() -> load(ImmutableMap.<String, ByteSource>of()))
      .isInstanceOf(SchemaException.class);
  }
}
