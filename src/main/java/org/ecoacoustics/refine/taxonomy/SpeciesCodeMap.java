package org.ecoacoustics.refine.taxonomy;

import org.ecoacoustics.refine.exception.TaxonomyException;

import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;

/**
 * Association between the ad-hoc codes annotators typed into column headers and the canonical eBird species codes.
 * Every ad-hoc code maps to exactly one canonical code; a canonical code may have several historical variants.
 */
public final class SpeciesCodeMap {

  private final ImmutableMap<String, String> canonicalByAdHoc;
  private final ImmutableSetMultimap<String, String> adHocByCanonical;
  private final ImmutableMap<String, String> scientificNames;
  private final ImmutableMap<String, String> commonNames;

  SpeciesCodeMap(Map<String, String> canonicalByAdHoc, Map<String, String> scientificNames,
    Map<String, String> commonNames) {
    this.canonicalByAdHoc = ImmutableMap.copyOf(canonicalByAdHoc);
    this.adHocByCanonical = this.canonicalByAdHoc.asMultimap().inverse();
    this.scientificNames = ImmutableMap.copyOf(scientificNames);
    this.commonNames = ImmutableMap.copyOf(commonNames);
  }

  /**
   * Rename a column header. Headers that aren't ad-hoc species codes (metadata columns) pass through unchanged.
   *
   * @param column column header
   *
   * @return canonical code, or the header itself if it isn't a known ad-hoc code
   */
  public String rename(String column) {
    String canonical = canonicalByAdHoc.get(column.trim());
    return canonical == null ? column : canonical;
  }

  /**
   * Resolve an ad-hoc species code to its canonical code.
   *
   * @param adHocCode code used in an annotation file header
   *
   * @return canonical species code
   *
   * @throws TaxonomyException if the code isn't listed in the taxonomy table
   */
  public String resolve(String adHocCode) throws TaxonomyException {
    String canonical = canonicalByAdHoc.get(adHocCode.trim());
    if (canonical == null) {
      throw new TaxonomyException("Species annotation code not found in taxonomy table: " + adHocCode);
    }
    return canonical;
  }

  public boolean isAdHocCode(String column) {
    return canonicalByAdHoc.containsKey(column.trim());
  }

  /**
   * @return all ad-hoc codes annotators used for the canonical code (empty if unknown)
   */
  public Set<String> adHocCodes(String canonicalCode) {
    return adHocByCanonical.get(canonicalCode);
  }

  public Set<String> canonicalCodes() {
    return adHocByCanonical.keySet();
  }

  @Nullable
  public String scientificName(String canonicalCode) {
    return scientificNames.get(canonicalCode);
  }

  @Nullable
  public String commonName(String canonicalCode) {
    return commonNames.get(canonicalCode);
  }

  public int size() {
    return canonicalByAdHoc.size();
  }
}
