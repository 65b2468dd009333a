package org.ecoacoustics.refine.utils;

import java.time.format.DateTimeFormatter;

/**
 * Constants used across classes.
 */
public class Constants {

  public static final DateTimeFormatter ISO_DF = DateTimeFormatter.ISO_LOCAL_DATE;
  public static final DateTimeFormatter COMPACT_DF = DateTimeFormatter.BASIC_ISO_DATE;

  // raw annotation file columns
  public static final String FILENAME = "Filename";
  public static final String RESTORATION_TYPE = "Restoration.Type..Benchmark.Active.Passive.";
  public static final String TIME_OF_DAY = "Time..Morning.Evening.Night.";
  public static final String FILENAME_DELIMITER = "_";
  public static final String NA = "NA";

  // taxonomy table columns
  public static final String EBIRD_CODES = "eBird_codes";
  public static final String ANNOTATION_CODES = "species_annotation_codes";
  public static final String SCIENTIFIC_NAME = "scientific_name";
  public static final String COMMON_NAME = "common_name";
  public static final String CODE_VARIANT_SEPARATOR = ";";

  public static final int CLOCK_DIGITS = 6;

  private Constants() {
  }
}
