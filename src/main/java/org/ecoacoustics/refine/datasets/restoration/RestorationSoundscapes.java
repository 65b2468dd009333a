package org.ecoacoustics.refine.datasets.restoration;

import org.ecoacoustics.refine.annotation.AnnotationLoader;
import org.ecoacoustics.refine.annotation.AnnotationTable;
import org.ecoacoustics.refine.annotation.Season;
import org.ecoacoustics.refine.config.PipelineConfig;
import org.ecoacoustics.refine.event.ActivityFilter;
import org.ecoacoustics.refine.event.DetectionEvent;
import org.ecoacoustics.refine.event.EventNormalizer;
import org.ecoacoustics.refine.event.TemporalBinner;
import org.ecoacoustics.refine.event.TimeOfDay;
import org.ecoacoustics.refine.event.ZeroCountSymmetrizer;
import org.ecoacoustics.refine.exception.RefineException;
import org.ecoacoustics.refine.taxonomy.SpeciesCodeMap;
import org.ecoacoustics.refine.taxonomy.TaxonomyMapper;
import org.ecoacoustics.refine.utils.DatasetWriter;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import javax.validation.constraints.NotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.ByteSource;
import com.google.common.io.Files;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class is used to clean, reshape, and filter the manually annotated dawn and dusk recordings made at benchmark,
 * actively restored and passively restored sites over a summer and a winter season into a single detection events
 * table: one row per recording chunk and species heard in it.
 */
public class RestorationSoundscapes {

  private static final Logger LOG = LoggerFactory.getLogger(RestorationSoundscapes.class);

  private RestorationSoundscapes() {
  }

  public static void main(String[] args) {
    try {
      // optional properties file overriding the bundled defaults
      PipelineConfig config = args.length > 0 ? PipelineConfig.fromFile(new File(args[0])) : PipelineConfig.defaults();
      List<DetectionEvent> events = processDetections(config);
      LOG.info("Processing complete! " + events.size() + " detection events written to: "
               + config.getOutputFile().getAbsolutePath());
    } catch (RefineException | IOException e) {
      LOG.error("Refinement aborted, no detection events written", e);
      System.exit(1);
    }
  }

  /**
   * Reads the taxonomy table and the four annotation files named in the configuration, refines them, and writes the
   * detection events table. Nothing is written unless every earlier step succeeded.
   *
   * @param config run configuration
   *
   * @return the detection events written
   *
   * @throws IOException if an input can't be read or the output can't be written
   * @throws RefineException if the taxonomy or an annotation file is invalid
   */
  @NotNull
  public static List<DetectionEvent> processDetections(PipelineConfig config) throws IOException, RefineException {
    SpeciesCodeMap codes = TaxonomyMapper.load(config.getTaxonomyFile());

    Map<TimeOfDay, Map<String, ByteSource>> sources = Maps.newEnumMap(TimeOfDay.class);
    for (TimeOfDay tod : TimeOfDay.values()) {
      Map<String, ByteSource> perSeason = Maps.newLinkedHashMap();
      for (Season season : Season.values()) {
        File file = config.getAnnotationFile(season, tod);
        perSeason.put(file.getPath(), Files.asByteSource(file));
      }
      sources.put(tod, perSeason);
    }

    List<DetectionEvent> events = refine(codes, sources, config);
    DatasetWriter.write(events, config.getOutputFile());
    return events;
  }

  /**
   * Runs every refinement step in memory:
   * i) loads and unifies the annotation files of each time of day
   * ii) reshapes them into detection events with canonical species codes
   * iii) assigns hour of day buckets
   * iv) drops species below the minimum occurrence threshold
   * v) optionally adds zero-count records so every species appears in both times of day
   *
   * @param codes ad-hoc to canonical species code map
   * @param sources annotation file content per time of day, keyed by source name
   * @param config run configuration
   *
   * @return detection events in output order
   *
   * @throws IOException if an annotation file can't be read
   * @throws RefineException if an annotation file is invalid or references an unknown species code
   */
  @NotNull
  public static ImmutableList<DetectionEvent> refine(SpeciesCodeMap codes,
    Map<TimeOfDay, Map<String, ByteSource>> sources, PipelineConfig config) throws IOException, RefineException {
    List<AnnotationTable> tables = Lists.newArrayList();
    for (Map.Entry<TimeOfDay, Map<String, ByteSource>> entry : sources.entrySet()) {
      TimeOfDay tod = entry.getKey();
      tables.add(AnnotationLoader.load(tod, config.getWindow(tod), config.getMetadataColumns(), entry.getValue()));
    }

    ImmutableList<DetectionEvent> events = EventNormalizer.normalize(tables, codes);
    events = TemporalBinner.bin(events);
    events = ActivityFilter.filter(events, config.getMinimumOccurrenceThreshold());
    if (config.isSymmetrizeTimeOfDay()) {
      events = ZeroCountSymmetrizer.symmetrize(events);
    }
    LOG.info("Refined " + events.size() + " detection events.");
    return events;
  }
}
