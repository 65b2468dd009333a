package org.ecoacoustics.refine.event;

/**
 * Daily recording window an annotation file was collected in. It is assigned from the file a row came from, never
 * from the row's clock time.
 */
public enum TimeOfDay {
  DAWN("dawn"),
  DUSK("dusk");

  private final String label;

  TimeOfDay(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
