package org.ecoacoustics.refine.annotation;

import org.ecoacoustics.refine.event.TimeOfDay;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * All annotated chunks of one time of day, concatenated across seasons.
 */
public final class AnnotationTable {

  private final TimeOfDay timeOfDay;
  private final ImmutableList<String> speciesColumns;
  private final ImmutableList<AnnotationRow> rows;
  private final int rowsOutsideWindow;

  public AnnotationTable(TimeOfDay timeOfDay, List<String> speciesColumns, List<AnnotationRow> rows,
    int rowsOutsideWindow) {
    this.timeOfDay = timeOfDay;
    this.speciesColumns = ImmutableList.copyOf(speciesColumns);
    this.rows = ImmutableList.copyOf(rows);
    this.rowsOutsideWindow = rowsOutsideWindow;
  }

  public TimeOfDay getTimeOfDay() {
    return timeOfDay;
  }

  /**
   * @return ad-hoc species codes, in the column order of the first source file
   */
  public ImmutableList<String> getSpeciesColumns() {
    return speciesColumns;
  }

  public ImmutableList<AnnotationRow> getRows() {
    return rows;
  }

  /**
   * @return number of rows whose start time lies outside the provenance window of their time of day
   */
  public int getRowsOutsideWindow() {
    return rowsOutsideWindow;
  }
}
