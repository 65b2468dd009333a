package org.ecoacoustics.refine.utils;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import javax.validation.constraints.NotNull;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Set of utilities used to operate on files.
 */
public class FileUtils {

  private static final Logger LOG = LoggerFactory.getLogger(FileUtils.class);
  private static final Pattern escapeChars = Pattern.compile("[\t\n\r]");
  private static final char BOM = '\uFEFF';
  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  private FileUtils() {
  }

  /**
   * Clean a single cell value. Line breaking characters encountered in the value are replaced with a space, and
   * the result is trimmed.
   *
   * @param value raw cell value
   *
   * @return cleaned value, or null if nothing remains
   */
  @Nullable
  public static String clean(@Nullable String value) {
    if (value == null) {
      return null;
    }
    return StringUtils.trimToNull(escapeChars.matcher(value).replaceAll(" "));
  }

  /**
   * Read every row of a comma separated file, header row included. Empty lines are skipped, and a leading byte
   * order mark is removed from the first header cell.
   *
   * @param stream UTF-8 encoded CSV content, closed by this method
   *
   * @return list of rows, the first being the header row (empty list if the file has no content)
   *
   * @throws IOException if the content can't be read or isn't valid CSV
   */
  @NotNull
  public static List<String[]> readCsv(InputStream stream) throws IOException {
    ObjectReader reader = CSV_MAPPER.readerFor(String[].class)
      .with(CsvParser.Feature.WRAP_AS_ARRAY)
      .with(CsvParser.Feature.SKIP_EMPTY_LINES);

    List<String[]> rows = Lists.newArrayList();
    try (InputStream in = stream; MappingIterator<String[]> iter = reader.readValues(in)) {
      while (iter.hasNext()) {
        String[] record = iter.next();
        if (record == null || record.length == 0) {
          continue;
        }
        rows.add(record);
      }
    }
    if (!rows.isEmpty()) {
      String[] header = rows.get(0);
      if (header[0] != null && !header[0].isEmpty() && header[0].charAt(0) == BOM) {
        header[0] = header[0].substring(1);
      }
    }
    return rows;
  }

  /**
   * Read every row of a comma separated file, header row included.
   *
   * @param file CSV file
   *
   * @return list of rows, the first being the header row
   *
   * @throws IOException if the file can't be read
   */
  @NotNull
  public static List<String[]> readCsv(File file) throws IOException {
    return readCsv(new BufferedInputStream(new FileInputStream(file)));
  }

  /**
   * Create a new UTF-8 file, creating any missing parent directories first.
   *
   * @param file file to create, overwritten if it already exists
   *
   * @return writer on file
   *
   * @throws IOException if writer failed to be created
   */
  public static Writer startNewUtf8File(File file) throws IOException {
    Files.createParentDirs(file);
    return Files.newWriter(file, StandardCharsets.UTF_8);
  }

  /**
   * Replace the target file with the source file in a single step where the file system allows it.
   *
   * @param source fully written file
   * @param target final location
   *
   * @throws IOException if the file can't be moved
   */
  public static void moveIntoPlace(File source, File target) throws IOException {
    try {
      java.nio.file.Files.move(source.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING,
        StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      LOG.debug("Atomic move not supported, replacing " + target.getAbsolutePath() + " in two steps");
      java.nio.file.Files.move(source.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
