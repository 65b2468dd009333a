package org.ecoacoustics.refine.annotation;

import org.ecoacoustics.refine.exception.FilenameFormatException;
import org.ecoacoustics.refine.utils.Constants;
import org.ecoacoustics.refine.utils.TermUtils;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;

/**
 * Recording metadata encoded in an annotation filename, e.g. "S1_20220101_060000_3": site id, recording date,
 * clock time the chunk starts at, and the index of the 10 second split within the recording.
 */
public final class RecordingFilename {

  private static final Splitter SPLITTER = Splitter.on(Constants.FILENAME_DELIMITER);
  private static final Pattern AUDIO_EXTENSION = Pattern.compile("\\.(wav|flac|mp3)$", Pattern.CASE_INSENSITIVE);

  private final String siteId;
  private final LocalDate date;
  private final String startTime;
  private final String splitIndex;

  RecordingFilename(String siteId, LocalDate date, String startTime, String splitIndex) {
    this.siteId = siteId;
    this.date = date;
    this.startTime = startTime;
    this.splitIndex = splitIndex;
  }

  /**
   * Decompose a filename into exactly four _-separated parts. The date may be written as yyyyMMdd or yyyy-MM-dd,
   * and the clock time is left-padded to 6 digits.
   *
   * @param filename value of the Filename column
   *
   * @return recording metadata
   *
   * @throws FilenameFormatException if the filename doesn't have four non-empty parts, or its date or time can't
   * be read
   */
  public static RecordingFilename parse(String filename) throws FilenameFormatException {
    if (filename == null || filename.trim().isEmpty()) {
      throw new FilenameFormatException(String.valueOf(filename), "empty filename");
    }
    List<String> parts = SPLITTER.splitToList(filename.trim());
    if (parts.size() != 4) {
      throw new FilenameFormatException(filename, "expected 4 parts separated by " + Constants.FILENAME_DELIMITER
                                                  + " but found " + parts.size());
    }

    String siteId = parts.get(0).trim();
    if (siteId.isEmpty()) {
      throw new FilenameFormatException(filename, "empty site id");
    }

    LocalDate date = parseDate(filename, parts.get(1).trim());

    String startTime = TermUtils.padClockTime(parts.get(2).trim());
    if (startTime == null) {
      throw new FilenameFormatException(filename, "start time " + parts.get(2) + " isn't a HHMMSS clock time");
    }

    String splitIndex = AUDIO_EXTENSION.matcher(parts.get(3).trim()).replaceFirst("");
    if (splitIndex.isEmpty()) {
      throw new FilenameFormatException(filename, "empty split index");
    }

    return new RecordingFilename(siteId, date, startTime, splitIndex);
  }

  private static LocalDate parseDate(String filename, String date) throws FilenameFormatException {
    try {
      if (date.length() == 8) {
        return LocalDate.parse(date, Constants.COMPACT_DF);
      }
      return LocalDate.parse(date, Constants.ISO_DF);
    } catch (DateTimeParseException e) {
      throw new FilenameFormatException(filename, "date " + date + " isn't yyyyMMdd or yyyy-MM-dd");
    }
  }

  public String getSiteId() {
    return siteId;
  }

  public LocalDate getDate() {
    return date;
  }

  /**
   * @return 6 digit zero-padded HHMMSS clock time
   */
  public String getStartTime() {
    return startTime;
  }

  public String getSplitIndex() {
    return splitIndex;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RecordingFilename)) {
      return false;
    }
    RecordingFilename that = (RecordingFilename) o;
    return siteId.equals(that.siteId) && date.equals(that.date) && startTime.equals(that.startTime)
           && splitIndex.equals(that.splitIndex);
  }

  @Override
  public int hashCode() {
    return Objects.hash(siteId, date, startTime, splitIndex);
  }

  @Override
  public String toString() {
    return siteId + Constants.FILENAME_DELIMITER + date.format(Constants.COMPACT_DF) + Constants.FILENAME_DELIMITER
           + startTime + Constants.FILENAME_DELIMITER + splitIndex;
  }
}
