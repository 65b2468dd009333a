package org.ecoacoustics.refine.exception;

import java.io.File;
import java.io.IOException;

/**
 * Thrown when the detection events file can't be written to its destination.
 */
public class DatasetWriteException extends IOException {

  public DatasetWriteException(File destination, Throwable cause) {
    super("Failed to write detection events to " + destination.getAbsolutePath(), cause);
  }

  public DatasetWriteException(File destination, String reason) {
    super("Failed to write detection events to " + destination.getAbsolutePath() + ": " + reason);
  }
}
