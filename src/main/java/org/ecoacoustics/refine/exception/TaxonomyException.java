package org.ecoacoustics.refine.exception;

/**
 * Thrown when the species code table is ambiguous, or when an annotation code can't be resolved to a canonical
 * species code.
 */
public class TaxonomyException extends RefineException {

  public TaxonomyException(String message) {
    super(message);
  }
}
