package org.ecoacoustics.refine.annotation;

import org.ecoacoustics.refine.event.ClockWindow;
import org.ecoacoustics.refine.event.TimeOfDay;
import org.ecoacoustics.refine.exception.SchemaException;
import org.ecoacoustics.refine.utils.Constants;
import org.ecoacoustics.refine.utils.FileUtils;
import org.ecoacoustics.refine.utils.TermUtils;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.validation.constraints.NotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.io.ByteSource;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the raw annotation files of one time of day (one per season) and unifies them into a single
 * {@link AnnotationTable}.
 */
public class AnnotationLoader {

  private static final Logger LOG = LoggerFactory.getLogger(AnnotationLoader.class);
  private static final Joiner COMMA = Joiner.on(", ");

  private AnnotationLoader() {
  }

  /**
   * Iterates over each season's annotation file and does the following:
   * i) repairs it (e.g. trims header names, removes unnamed empty columns, skips blank rows, pads short rows)
   * ii) validates it (e.g. every season must have exactly the same columns, every filename must decompose into
   * site, date, start time and split index)
   * iii) drops annotator metadata columns and the time column, which is replaced by the provenance time of day
   *
   * @param timeOfDay window every file was recorded in, assigned to every row regardless of its clock time
   * @param provenanceWindow clock times expected for this time of day, only used to report rows outside it
   * @param metadataColumns annotator columns carrying no species information
   * @param sources annotation file content keyed by source name (e.g. season), in concatenation order
   *
   * @return unified table
   *
   * @throws IOException if a file can't be read
   * @throws SchemaException if columns don't match across files, or a row or filename is malformed
   */
  @NotNull
  public static AnnotationTable load(TimeOfDay timeOfDay, ClockWindow provenanceWindow, Set<String> metadataColumns,
    Map<String, ByteSource> sources) throws IOException, SchemaException {
    if (sources.isEmpty()) {
      throw new SchemaException("No " + timeOfDay + " annotation files to load");
    }

    Set<String> ignored = ImmutableSet.<String>builder()
      .addAll(metadataColumns)
      .add(Constants.TIME_OF_DAY)
      .build();

    List<String> referenceHeader = null;
    String referenceSource = null;
    List<String> speciesColumns = null;
    List<AnnotationRow> rows = Lists.newArrayList();
    int outsideWindow = 0;

    for (Map.Entry<String, ByteSource> source : sources.entrySet()) {
      String name = source.getKey();
      List<String[]> records = FileUtils.readCsv(source.getValue().openBufferedStream());
      if (records.isEmpty()) {
        throw new SchemaException("Annotation file " + name + " has no header row");
      }

      String[] rawHeader = records.get(0);
      List<Integer> kept = keptColumns(name, rawHeader, records.subList(1, records.size()));
      List<String> header = Lists.newArrayList();
      for (int idx : kept) {
        header.add(rawHeader[idx].trim());
      }
      validateHeader(name, header);

      if (referenceHeader == null) {
        referenceHeader = header;
        referenceSource = name;
        speciesColumns = Lists.newArrayList();
        for (String column : header) {
          if (!isMetadata(column, ignored)) {
            speciesColumns.add(column);
          }
        }
      } else {
        compareColumns(referenceSource, referenceHeader, name, header);
      }

      int line = 0;
      int blankRows = 0;
      for (String[] record : records.subList(1, records.size())) {
        line++;
        if (StringUtils.isAllBlank(record)) {
          blankRows++;
          continue;
        }
        if (record.length > rawHeader.length) {
          throw new SchemaException(
            "Line " + line + " of " + name + " has " + record.length + " cells but the header has " + rawHeader.length);
        }
        // short rows are missing trailing blank cells
        String[] padded = Arrays.copyOf(record, rawHeader.length);

        Map<String, String> cells = Maps.newHashMap();
        for (int i = 0; i < kept.size(); i++) {
          String value = padded[kept.get(i)];
          cells.put(header.get(i), value == null ? "" : value);
        }

        RecordingFilename recording = RecordingFilename.parse(cells.get(Constants.FILENAME));
        if (!provenanceWindow.contains(recording.getStartTime())) {
          outsideWindow++;
          LOG.debug(name + " line " + line + " starts at " + recording.getStartTime() + ", outside the "
                    + timeOfDay + " window " + provenanceWindow);
        }

        Map<String, String> speciesCells = Maps.newLinkedHashMap();
        for (String code : speciesColumns) {
          speciesCells.put(code, cells.get(code));
        }

        rows.add(new AnnotationRow(name, line, recording, timeOfDay,
          FileUtils.clean(cells.get(Constants.RESTORATION_TYPE)), speciesCells));
      }
      if (blankRows > 0) {
        LOG.warn("Skipped " + blankRows + " blank rows in " + name);
      }
      LOG.info("Iterated over " + line + " rows in " + timeOfDay + " file " + name + ".");
    }

    if (outsideWindow > 0) {
      LOG.warn(outsideWindow + " " + timeOfDay + " rows start outside " + provenanceWindow
               + "; they keep their " + timeOfDay + " label");
    }
    LOG.info("Loaded " + rows.size() + " " + timeOfDay + " rows with " + speciesColumns.size() + " species columns.");

    return new AnnotationTable(timeOfDay, speciesColumns, rows, outsideWindow);
  }

  private static boolean isMetadata(String column, Set<String> ignored) {
    return column.equals(Constants.FILENAME) || column.equals(Constants.RESTORATION_TYPE) || ignored.contains(column);
  }

  /**
   * Spreadsheet exports often leave trailing unnamed columns. Those are skipped as long as they hold no value.
   *
   * @throws SchemaException if an unnamed column has a value in any row
   */
  private static List<Integer> keptColumns(String name, String[] header, List<String[]> records)
    throws SchemaException {
    List<Integer> kept = Lists.newArrayList();
    for (int i = 0; i < header.length; i++) {
      if (header[i] == null || header[i].trim().isEmpty()) {
        int line = 0;
        for (String[] record : records) {
          line++;
          if (i < record.length && !TermUtils.isAbsent(record[i])) {
            throw new SchemaException("Unnamed column #" + (i + 1) + " in " + name + " has value " + record[i]
                                      + " on line " + line);
          }
        }
        LOG.warn("Ignoring empty unnamed column #" + (i + 1) + " in " + name);
      } else {
        kept.add(i);
      }
    }
    return kept;
  }

  private static void validateHeader(String name, List<String> header) throws SchemaException {
    Set<String> seen = Sets.newHashSet();
    for (String column : header) {
      if (!seen.add(column)) {
        throw new SchemaException("Duplicate column " + column + " in " + name);
      }
    }
    if (!seen.contains(Constants.FILENAME)) {
      throw new SchemaException("Annotation file " + name + " has no " + Constants.FILENAME + " column");
    }
  }

  private static void compareColumns(String referenceSource, List<String> reference, String name, List<String> header)
    throws SchemaException {
    Set<String> expected = ImmutableSet.copyOf(reference);
    Set<String> actual = ImmutableSet.copyOf(header);
    if (expected.equals(actual)) {
      return;
    }
    List<String> missing = ImmutableList.copyOf(Sets.difference(expected, actual));
    List<String> extra = ImmutableList.copyOf(Sets.difference(actual, expected));
    StringBuilder sb = new StringBuilder("Columns of " + name + " don't match " + referenceSource + ":");
    if (!missing.isEmpty()) {
      sb.append(" missing [").append(COMMA.join(missing)).append("]");
    }
    if (!extra.isEmpty()) {
      sb.append(" extra [").append(COMMA.join(extra)).append("]");
    }
    throw new SchemaException(sb.toString());
  }
}
