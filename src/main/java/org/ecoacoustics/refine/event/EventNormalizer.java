package org.ecoacoustics.refine.event;

import org.ecoacoustics.refine.annotation.AnnotationRow;
import org.ecoacoustics.refine.annotation.AnnotationTable;
import org.ecoacoustics.refine.annotation.RecordingFilename;
import org.ecoacoustics.refine.exception.SchemaException;
import org.ecoacoustics.refine.exception.TaxonomyException;
import org.ecoacoustics.refine.taxonomy.SpeciesCodeMap;
import org.ecoacoustics.refine.utils.FileUtils;
import org.ecoacoustics.refine.utils.TermUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;
import javax.validation.constraints.NotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reshapes wide annotation rows (one column per ad-hoc species code) into long detection events (one per recording
 * chunk and canonical species), dropping every zero count.
 */
public class EventNormalizer {

  private static final Logger LOG = LoggerFactory.getLogger(EventNormalizer.class);

  private EventNormalizer() {
  }

  /**
   * Normalizes every table and returns the union of their events in output order.
   *
   * @param tables one annotation table per time of day
   * @param codes ad-hoc to canonical species code map
   *
   * @return detection events of all tables, sorted by {@link DetectionEvent#ORDER}
   *
   * @throws TaxonomyException if a species column can't be resolved to a canonical code
   * @throws SchemaException if a count cell isn't a non-negative whole number
   */
  @NotNull
  public static ImmutableList<DetectionEvent> normalize(List<AnnotationTable> tables, SpeciesCodeMap codes)
    throws TaxonomyException, SchemaException {
    List<DetectionEvent> events = Lists.newArrayList();
    for (AnnotationTable table : tables) {
      events.addAll(normalize(table, codes));
    }
    return ImmutableList.sortedCopyOf(DetectionEvent.ORDER, events);
  }

  /**
   * Iterates over the rows of one table and does the following:
   * i) reads every species cell as a count, blank cells counting as zero
   * ii) sums the counts of rows sharing site, date, start time, split index, time of day and restoration type, and
   * of ad-hoc codes sharing a canonical code
   * iii) emits one event per recording chunk and species with a nonzero sum
   *
   * @param table annotation table of one time of day
   * @param codes ad-hoc to canonical species code map
   *
   * @return detection events, sorted by {@link DetectionEvent#ORDER}
   *
   * @throws TaxonomyException if a species column can't be resolved to a canonical code
   * @throws SchemaException if a count cell isn't a non-negative whole number
   */
  @NotNull
  public static ImmutableList<DetectionEvent> normalize(AnnotationTable table, SpeciesCodeMap codes)
    throws TaxonomyException, SchemaException {
    Map<String, String> canonicalByColumn = resolveColumns(table, codes);

    // per chunk, summed counts keyed by canonical code
    Map<ChunkKey, Map<String, Integer>> sums = Maps.newLinkedHashMap();
    int duplicates = 0;
    for (AnnotationRow row : table.getRows()) {
      ChunkKey key = new ChunkKey(row.getRecording(), row.getTimeOfDay(), row.getRestorationType());
      Map<String, Integer> counts = sums.get(key);
      if (counts == null) {
        counts = Maps.newTreeMap();
        sums.put(key, counts);
      } else {
        duplicates++;
      }

      for (Map.Entry<String, String> cell : row.getSpeciesCells().entrySet()) {
        int count = parseCount(cell.getValue(), row, cell.getKey());
        if (count > 0) {
          String canonical = canonicalByColumn.get(cell.getKey());
          Integer previous = counts.get(canonical);
          counts.put(canonical, previous == null ? count : previous + count);
        }
      }
    }

    List<DetectionEvent> events = Lists.newArrayList();
    int silentChunks = 0;
    for (Map.Entry<ChunkKey, Map<String, Integer>> chunk : sums.entrySet()) {
      ChunkKey key = chunk.getKey();
      if (chunk.getValue().isEmpty()) {
        silentChunks++;
        continue;
      }
      for (Map.Entry<String, Integer> species : chunk.getValue().entrySet()) {
        events.add(new DetectionEvent(key.recording.getSiteId(), key.recording.getDate(),
          key.recording.getStartTime(), key.recording.getSplitIndex(), key.timeOfDay, null, key.restorationType,
          species.getKey(), species.getValue()));
      }
    }

    LOG.info("Iterated over " + table.getRows().size() + " " + table.getTimeOfDay() + " rows.");
    if (duplicates > 0) {
      LOG.info("Merged " + duplicates + " duplicate " + table.getTimeOfDay() + " rows into existing chunks.");
    }
    LOG.info("Found " + sums.size() + " unique " + table.getTimeOfDay() + " chunks, " + silentChunks
             + " without any detection.");
    LOG.info("Emitted " + events.size() + " " + table.getTimeOfDay() + " detection events.");
    return ImmutableList.sortedCopyOf(DetectionEvent.ORDER, events);
  }

  /**
   * All species columns are resolved up front so a run reports every unknown code at once.
   */
  private static Map<String, String> resolveColumns(AnnotationTable table, SpeciesCodeMap codes)
    throws TaxonomyException {
    Map<String, String> canonicalByColumn = Maps.newHashMap();
    Set<String> unresolved = Sets.newTreeSet();
    for (String column : table.getSpeciesColumns()) {
      if (codes.isAdHocCode(column)) {
        canonicalByColumn.put(column, codes.resolve(column));
        LOG.debug("Renaming " + table.getTimeOfDay() + " column " + column + " to " + codes.rename(column));
      } else {
        unresolved.add(column);
      }
    }
    if (!unresolved.isEmpty()) {
      LOG.error("***** " + unresolved.size() + " " + table.getTimeOfDay() + " species codes not found in taxonomy: "
                + unresolved);
      throw new TaxonomyException("Unresolved species annotation codes in " + table.getTimeOfDay() + " files: "
                                  + unresolved);
    }
    return canonicalByColumn;
  }

  /**
   * Read a count cell. Blank and NA cells are zero; spreadsheet exports may write whole numbers as decimals
   * (e.g. 3.0).
   */
  static int parseCount(@Nullable String cell, AnnotationRow row, String column) throws SchemaException {
    if (TermUtils.isAbsent(cell)) {
      return 0;
    }
    String value = FileUtils.clean(cell);
    try {
      BigDecimal count = new BigDecimal(value);
      if (count.signum() < 0) {
        throw new SchemaException(describe(row, column) + " has a negative count: " + value);
      }
      return count.intValueExact();
    } catch (NumberFormatException | ArithmeticException e) {
      throw new SchemaException(describe(row, column) + " isn't a whole number count: " + value, e);
    }
  }

  private static String describe(AnnotationRow row, String column) {
    return "Column " + column + " on line " + row.getLine() + " of " + row.getSource();
  }

  /**
   * Identity of one annotated chunk.
   */
  private static final class ChunkKey {

    private final RecordingFilename recording;
    private final TimeOfDay timeOfDay;
    private final String restorationType;

    private ChunkKey(RecordingFilename recording, TimeOfDay timeOfDay, @Nullable String restorationType) {
      this.recording = recording;
      this.timeOfDay = timeOfDay;
      this.restorationType = restorationType;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof ChunkKey)) {
        return false;
      }
      ChunkKey that = (ChunkKey) o;
      return recording.equals(that.recording) && timeOfDay == that.timeOfDay
             && Objects.equals(restorationType, that.restorationType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(recording, timeOfDay, restorationType);
    }
  }
}
