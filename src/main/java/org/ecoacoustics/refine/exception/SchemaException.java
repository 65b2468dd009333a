package org.ecoacoustics.refine.exception;

/**
 * Thrown when the columns or cells of an annotation file don't have the expected structure.
 */
public class SchemaException extends RefineException {

  public SchemaException(String message) {
    super(message);
  }

  public SchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
