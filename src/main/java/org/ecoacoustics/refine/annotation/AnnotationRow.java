package org.ecoacoustics.refine.annotation;

import org.ecoacoustics.refine.event.TimeOfDay;

import java.util.Map;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * One manually annotated 10 second audio chunk, with its raw count cell for every species column.
 */
public final class AnnotationRow {

  private final String source;
  private final int line;
  private final RecordingFilename recording;
  private final TimeOfDay timeOfDay;
  private final String restorationType;
  private final ImmutableMap<String, String> speciesCells;

  public AnnotationRow(String source, int line, RecordingFilename recording, TimeOfDay timeOfDay,
    @Nullable String restorationType, Map<String, String> speciesCells) {
    this.source = source;
    this.line = line;
    this.recording = recording;
    this.timeOfDay = timeOfDay;
    this.restorationType = restorationType;
    this.speciesCells = ImmutableMap.copyOf(speciesCells);
  }

  /**
   * @return name of the file the row was read from
   */
  public String getSource() {
    return source;
  }

  /**
   * @return data line number within its source file, header excluded
   */
  public int getLine() {
    return line;
  }

  public RecordingFilename getRecording() {
    return recording;
  }

  public TimeOfDay getTimeOfDay() {
    return timeOfDay;
  }

  @Nullable
  public String getRestorationType() {
    return restorationType;
  }

  /**
   * @return raw cell value keyed by ad-hoc species code, in column order (blank cells kept as empty strings)
   */
  public ImmutableMap<String, String> getSpeciesCells() {
    return speciesCells;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("source", source)
      .add("line", line)
      .add("recording", recording)
      .add("timeOfDay", timeOfDay)
      .add("restorationType", restorationType)
      .toString();
  }
}
