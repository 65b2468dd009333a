package org.ecoacoustics.refine.exception;

/**
 * Thrown when a configuration value is missing or can't be interpreted.
 */
public class ConfigurationException extends RefineException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
