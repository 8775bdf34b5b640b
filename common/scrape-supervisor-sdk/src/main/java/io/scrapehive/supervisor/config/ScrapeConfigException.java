package io.scrapehive.supervisor.config;

import java.util.Objects;

/**
 * Configuration could not be turned into, or applied as, an engine job configuration.
 * The supervisor keeps its previous configuration when this is thrown.
 */
public class ScrapeConfigException extends RuntimeException {

  public enum Stage {
    /** Translating arguments into an engine job configuration. */
    BUILD,
    /** Engine rejected the job configuration. */
    APPLY
  }

  private final Stage stage;

  public ScrapeConfigException(Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  public Stage stage() {
    return stage;
  }
}
