package io.scrapehive.supervisor.runtime;

/**
 * Lifecycle state of a scrape supervisor. {@link #STOPPED} is terminal.
 */
public enum SupervisorState {
  INITIALIZING,
  RUNNING,
  STOPPED
}
