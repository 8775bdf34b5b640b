package io.scrapehive.supervisor.engine;

/**
 * Raised by an engine that refuses a job configuration.
 */
public class EngineConfigRejectedException extends Exception {

  public EngineConfigRejectedException(String message) {
    super(message);
  }

  public EngineConfigRejectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
