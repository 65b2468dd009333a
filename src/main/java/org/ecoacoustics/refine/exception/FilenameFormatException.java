package org.ecoacoustics.refine.exception;

/**
 * Thrown when a recording filename can't be decomposed into site, date, start time and split index.
 */
public class FilenameFormatException extends SchemaException {

  public FilenameFormatException(String filename, String reason) {
    super("Malformed filename [" + filename + "]: " + reason);
  }
}
