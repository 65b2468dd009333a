package org.ecoacoustics.refine.utils;

import org.ecoacoustics.refine.event.DetectionEvent;
import org.ecoacoustics.refine.exception.DatasetWriteException;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the detection events table, the file every downstream analysis reads.
 */
public class DatasetWriter {

  private static final Logger LOG = LoggerFactory.getLogger(DatasetWriter.class);
  private static final CsvMapper CSV_MAPPER = new CsvMapper();
  private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(DetectionEvent.class)
    .withHeader()
    .withLineSeparator("\n");

  private DatasetWriter() {
  }

  /**
   * @return output column names, in order
   */
  public static String[] getHeader() {
    String[] header = new String[SCHEMA.size()];
    for (int i = 0; i < header.length; i++) {
      header[i] = SCHEMA.columnName(i);
    }
    return header;
  }

  /**
   * Write the events as UTF-8 CSV with a header row. The content first goes to a hidden sibling file which is then
   * moved onto the destination, so readers never see a partially written table.
   *
   * @param events detection events, written in the given order
   * @param destination output file, replaced if it exists
   *
   * @throws DatasetWriteException if the destination can't be written
   */
  public static void write(List<DetectionEvent> events, File destination) throws DatasetWriteException {
    if (destination.isDirectory()) {
      throw new DatasetWriteException(destination, "destination is a directory");
    }
    File parent = destination.getAbsoluteFile().getParentFile();
    File tmp = new File(parent, "." + destination.getName() + ".tmp");

    try {
      try (Writer writer = FileUtils.startNewUtf8File(tmp);
           SequenceWriter rows = CSV_MAPPER.writer(SCHEMA).writeValues(writer)) {
        rows.writeAll(events);
      }
      FileUtils.moveIntoPlace(tmp, destination);
    } catch (IOException e) {
      if (tmp.exists() && !tmp.delete()) {
        LOG.warn("Could not remove temporary file " + tmp.getAbsolutePath());
      }
      throw new DatasetWriteException(destination, e);
    }
    LOG.info("Wrote " + events.size() + " detection events to " + destination.getAbsolutePath());
  }
}
