package org.ecoacoustics.refine.annotation;

/**
 * Field season a batch of recordings was annotated for.
 */
public enum Season {
  SUMMER("summer"),
  WINTER("winter");

  private final String label;

  Season(String label) {
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
