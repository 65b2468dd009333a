package org.ecoacoustics.refine.config;

import org.ecoacoustics.refine.annotation.Season;
import org.ecoacoustics.refine.event.ClockWindow;
import org.ecoacoustics.refine.event.TimeOfDay;
import org.ecoacoustics.refine.exception.ConfigurationException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

/**
 * Settings of one refinement run. Defaults come from the bundled /config/refine.properties; any key can be
 * overridden by an external properties file.
 */
public final class PipelineConfig {

  public static final String MINIMUM_OCCURRENCE_THRESHOLD = "minimum_occurrence_threshold";
  public static final String DAWN_WINDOW = "dawn_window";
  public static final String DUSK_WINDOW = "dusk_window";
  public static final String SYMMETRIZE_TIME_OF_DAY = "symmetrize_time_of_day";
  public static final String METADATA_COLUMNS = "annotator_metadata_columns";
  public static final String BASE_DIR = "base.dir";
  public static final String TAXONOMY_FILE = "taxonomy.file";
  public static final String OUTPUT_FILE = "output.file";
  public static final String INPUT_PREFIX = "input.";

  private static final String DEFAULTS_RESOURCE = "/config/refine.properties";
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static Properties defaultProperties;

  private final int minimumOccurrenceThreshold;
  private final ImmutableMap<TimeOfDay, ClockWindow> windows;
  private final boolean symmetrizeTimeOfDay;
  private final ImmutableSet<String> metadataColumns;
  private final ImmutableMap<String, File> annotationFiles;
  private final File taxonomyFile;
  private final File outputFile;

  private PipelineConfig(Properties p) throws ConfigurationException {
    minimumOccurrenceThreshold = parseThreshold(required(p, MINIMUM_OCCURRENCE_THRESHOLD));
    windows = ImmutableMap.of(
      TimeOfDay.DAWN, ClockWindow.parseClosed(required(p, DAWN_WINDOW)),
      TimeOfDay.DUSK, ClockWindow.parseClosed(required(p, DUSK_WINDOW)));
    symmetrizeTimeOfDay =
      parseBoolean(SYMMETRIZE_TIME_OF_DAY, Strings.nullToEmpty(p.getProperty(SYMMETRIZE_TIME_OF_DAY)));
    metadataColumns = ImmutableSet.copyOf(LIST_SPLITTER.split(Strings.nullToEmpty(p.getProperty(METADATA_COLUMNS))));

    File baseDir = new File(Strings.isNullOrEmpty(p.getProperty(BASE_DIR)) ? "." : p.getProperty(BASE_DIR).trim());
    Map<String, File> files = Maps.newLinkedHashMap();
    for (TimeOfDay tod : TimeOfDay.values()) {
      for (Season season : Season.values()) {
        String key = inputKey(season, tod);
        files.put(key, resolve(baseDir, required(p, key)));
      }
    }
    annotationFiles = ImmutableMap.copyOf(files);
    taxonomyFile = resolve(baseDir, required(p, TAXONOMY_FILE));
    outputFile = resolve(baseDir, required(p, OUTPUT_FILE));
  }

  /**
   * Load the Properties bundled in the /config/refine.properties file.
   */
  static synchronized Properties defaultProperties() {
    if (defaultProperties == null) {
      Properties p = new Properties();
      try (InputStream in = PipelineConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
        if (in == null) {
          throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
        }
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to read " + DEFAULTS_RESOURCE, e);
      }
      defaultProperties = p;
    }
    return defaultProperties;
  }

  /**
   * @return configuration made of the bundled defaults only
   */
  public static PipelineConfig defaults() throws ConfigurationException {
    return fromProperties(new Properties());
  }

  /**
   * @param overrides properties taking precedence over the bundled defaults
   *
   * @return merged configuration
   *
   * @throws ConfigurationException if a value is missing or invalid
   */
  public static PipelineConfig fromProperties(Properties overrides) throws ConfigurationException {
    Properties merged = new Properties();
    merged.putAll(defaultProperties());
    merged.putAll(overrides);
    return new PipelineConfig(merged);
  }

  /**
   * @param overrides properties file taking precedence over the bundled defaults
   *
   * @return merged configuration
   *
   * @throws ConfigurationException if the file can't be read, or a value is missing or invalid
   */
  public static PipelineConfig fromFile(File overrides) throws ConfigurationException {
    Properties p = new Properties();
    try (Reader reader = Files.newBufferedReader(overrides.toPath(), StandardCharsets.UTF_8)) {
      p.load(reader);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read configuration " + overrides.getAbsolutePath(), e);
    }
    return fromProperties(p);
  }

  public static String inputKey(Season season, TimeOfDay timeOfDay) {
    return INPUT_PREFIX + season.getLabel() + "." + timeOfDay.getLabel();
  }

  private static String required(Properties p, String key) throws ConfigurationException {
    String value = p.getProperty(key);
    if (Strings.isNullOrEmpty(value) || value.trim().isEmpty()) {
      throw new ConfigurationException("Missing configuration value " + key);
    }
    return value.trim();
  }

  private static int parseThreshold(String value) throws ConfigurationException {
    int threshold;
    try {
      threshold = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(MINIMUM_OCCURRENCE_THRESHOLD + " must be an integer, got: " + value, e);
    }
    if (threshold < 0) {
      throw new ConfigurationException(MINIMUM_OCCURRENCE_THRESHOLD + " must not be negative, got: " + value);
    }
    return threshold;
  }

  private static boolean parseBoolean(String key, String value) throws ConfigurationException {
    String v = value.trim();
    if (v.isEmpty() || v.equalsIgnoreCase("false")) {
      return false;
    } else if (v.equalsIgnoreCase("true")) {
      return true;
    }
    throw new ConfigurationException(key + " must be true or false, got: " + value);
  }

  private static File resolve(File baseDir, String path) {
    File file = new File(path);
    return file.isAbsolute() ? file : new File(baseDir, path);
  }

  public int getMinimumOccurrenceThreshold() {
    return minimumOccurrenceThreshold;
  }

  /**
   * @return clock times recordings of this time of day are expected to start in
   */
  public ClockWindow getWindow(TimeOfDay timeOfDay) {
    return windows.get(timeOfDay);
  }

  public boolean isSymmetrizeTimeOfDay() {
    return symmetrizeTimeOfDay;
  }

  public Set<String> getMetadataColumns() {
    return metadataColumns;
  }

  public File getAnnotationFile(Season season, TimeOfDay timeOfDay) {
    return annotationFiles.get(inputKey(season, timeOfDay));
  }

  public File getTaxonomyFile() {
    return taxonomyFile;
  }

  public File getOutputFile() {
    return outputFile;
  }
}
