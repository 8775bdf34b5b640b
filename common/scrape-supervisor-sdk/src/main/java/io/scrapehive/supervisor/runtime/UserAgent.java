package io.scrapehive.supervisor.runtime;

/**
 * User-Agent sent by engines created for a supervisor.
 */
public final class UserAgent {

  private static final String VALUE = "ScrapeHive/" + version();

  private UserAgent() {
  }

  public static String value() {
    return VALUE;
  }

  private static String version() {
    String version = UserAgent.class.getPackage().getImplementationVersion();
    return version == null || version.isBlank() ? "dev" : version;
  }
}
