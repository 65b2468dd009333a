package org.ecoacoustics.refine.exception;

/**
 * Base class of all fatal errors raised while refining the annotation files. Any of these aborts the run before the
 * detection events file is written.
 */
public class RefineException extends Exception {

  public RefineException(String message) {
    super(message);
  }

  public RefineException(String message, Throwable cause) {
    super(message, cause);
  }
}
