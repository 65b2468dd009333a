package org.ecoacoustics.refine.event;

import com.google.common.base.MoreObjects;

/**
 * How many distinct site and date combinations a species was heard on, and whether that was enough to keep it.
 */
public final class SpeciesActivitySummary {

  private final String speciesCode;
  private final int activeSiteDates;
  private final boolean retained;

  public SpeciesActivitySummary(String speciesCode, int activeSiteDates, boolean retained) {
    this.speciesCode = speciesCode;
    this.activeSiteDates = activeSiteDates;
    this.retained = retained;
  }

  public String getSpeciesCode() {
    return speciesCode;
  }

  public int getActiveSiteDates() {
    return activeSiteDates;
  }

  public boolean isRetained() {
    return retained;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("speciesCode", speciesCode)
      .add("activeSiteDates", activeSiteDates)
      .add("retained", retained)
      .toString();
  }
}
