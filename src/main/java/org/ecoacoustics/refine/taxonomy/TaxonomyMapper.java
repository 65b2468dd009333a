package org.ecoacoustics.refine.taxonomy;

import org.ecoacoustics.refine.exception.TaxonomyException;
import org.ecoacoustics.refine.utils.Constants;
import org.ecoacoustics.refine.utils.FileUtils;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link SpeciesCodeMap} from the standardized species code table.
 */
public class TaxonomyMapper {

  private static final Logger LOG = LoggerFactory.getLogger(TaxonomyMapper.class);
  private static final Splitter VARIANT_SPLITTER =
    Splitter.on(Constants.CODE_VARIANT_SEPARATOR).trimResults().omitEmptyStrings();

  private TaxonomyMapper() {
  }

  public static SpeciesCodeMap load(File taxonomyFile) throws IOException, TaxonomyException {
    LOG.info("Loading species codes from " + taxonomyFile.getAbsolutePath());
    return load(new BufferedInputStream(new FileInputStream(taxonomyFile)));
  }

  /**
   * Loads the taxonomy table: each row lists one canonical eBird code (column eBird_codes) and the ad-hoc code, or
   * ;-separated ad-hoc codes, annotators used for it (column species_annotation_codes). Optional scientific_name and
   * common_name columns are kept for reverse lookups.
   *
   * @param stream taxonomy CSV content, closed by this method
   *
   * @return map from ad-hoc code to canonical code
   *
   * @throws IOException if the table can't be read
   * @throws TaxonomyException if a required column is missing, or two canonical codes claim the same ad-hoc code
   */
  public static SpeciesCodeMap load(InputStream stream) throws IOException, TaxonomyException {
    List<String[]> rows = FileUtils.readCsv(stream);
    if (rows.isEmpty()) {
      throw new TaxonomyException("Taxonomy table is empty");
    }

    List<String> header = Arrays.asList(rows.get(0));
    int canonicalIdx = requiredColumn(header, Constants.EBIRD_CODES);
    int adHocIdx = requiredColumn(header, Constants.ANNOTATION_CODES);
    int scientificIdx = header.indexOf(Constants.SCIENTIFIC_NAME);
    int commonIdx = header.indexOf(Constants.COMMON_NAME);

    // insertion ordered, so iteration order follows the table
    Map<String, String> canonicalByAdHoc = Maps.newLinkedHashMap();
    Map<String, String> scientificNames = Maps.newHashMap();
    Map<String, String> commonNames = Maps.newHashMap();

    int line = 0;
    for (String[] record : rows.subList(1, rows.size())) {
      line++;
      String canonical = cell(record, canonicalIdx);
      String adHocCodes = cell(record, adHocIdx);
      if (canonical == null || adHocCodes == null) {
        LOG.debug("Skipping taxonomy line " + line + ": missing eBird or annotation code");
        continue;
      }

      for (String adHoc : VARIANT_SPLITTER.split(adHocCodes)) {
        String existing = canonicalByAdHoc.get(adHoc);
        if (existing == null) {
          canonicalByAdHoc.put(adHoc, canonical);
        } else if (!existing.equals(canonical)) {
          throw new TaxonomyException(
            "Ambiguous annotation code " + adHoc + ": claimed by both " + existing + " and " + canonical);
        } else {
          LOG.warn("Annotation code " + adHoc + " listed more than once for " + canonical);
        }
      }

      String scientificName = cell(record, scientificIdx);
      if (scientificName != null) {
        scientificNames.put(canonical, scientificName);
      }
      String commonName = cell(record, commonIdx);
      if (commonName != null) {
        commonNames.put(canonical, commonName);
      }
    }

    SpeciesCodeMap map = new SpeciesCodeMap(canonicalByAdHoc, scientificNames, commonNames);
    LOG.info("Iterated over " + line + " lines in taxonomy table.");
    LOG.info("Loaded " + map.size() + " annotation codes for " + map.canonicalCodes().size() + " species.");
    return map;
  }

  private static int requiredColumn(List<String> header, String column) throws TaxonomyException {
    int idx = header.indexOf(column);
    if (idx < 0) {
      throw new TaxonomyException("Taxonomy table has no " + column + " column, found: " + header);
    }
    return idx;
  }

  private static String cell(String[] record, int idx) {
    if (idx < 0 || idx >= record.length) {
      return null;
    }
    return Strings.emptyToNull(FileUtils.clean(record[idx]));
  }
}
