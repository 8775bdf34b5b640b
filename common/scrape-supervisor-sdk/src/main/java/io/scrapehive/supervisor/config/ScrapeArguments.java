package io.scrapehive.supervisor.config;

import io.scrapehive.supervisor.ports.SampleReceiver;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments accepted by the scrape supervisor on construction and on every update.
 * <p>
 * Instances are immutable; an update replaces the whole value.
 *
 * @param targets               targets to scrape, in discovery order
 * @param forwardTo             receivers for scraped samples
 * @param jobName               job label override; blank means "use the supervisor instance id"
 * @param honorLabels           keep scraped labels that clash with target labels
 * @param honorTimestamps       keep timestamps exposed by the target
 * @param params                query parameters appended to every scrape request
 * @param scrapeInterval        how often targets are scraped
 * @param scrapeTimeout         per-scrape timeout
 * @param metricsPath           HTTP path of the metrics endpoint
 * @param scheme                {@code http} or {@code https}
 * @param bodySizeLimit         max uncompressed body size in bytes, 0 for unlimited
 * @param sampleLimit           max samples per scrape after relabeling, 0 for unlimited
 * @param targetLimit           max targets after relabeling, 0 for unlimited
 * @param labelLimit            max labels per sample, 0 for unlimited
 * @param labelNameLengthLimit  max label name length, 0 for unlimited
 * @param labelValueLengthLimit max label value length, 0 for unlimited
 * @param httpClientConfig      HTTP client settings
 * @param extraMetrics          emit additional per-scrape series
 */
public record ScrapeArguments(
    List<DiscoveryTarget> targets,
    List<SampleReceiver> forwardTo,
    String jobName,
    boolean honorLabels,
    boolean honorTimestamps,
    Map<String, List<String>> params,
    Duration scrapeInterval,
    Duration scrapeTimeout,
    String metricsPath,
    String scheme,
    long bodySizeLimit,
    long sampleLimit,
    long targetLimit,
    long labelLimit,
    long labelNameLengthLimit,
    long labelValueLengthLimit,
    HttpClientConfig httpClientConfig,
    boolean extraMetrics
) {

  public static final String DEFAULT_METRICS_PATH = "/metrics";
  public static final String DEFAULT_SCHEME = "http";
  public static final Duration DEFAULT_SCRAPE_INTERVAL = Duration.ofMinutes(1);
  public static final Duration DEFAULT_SCRAPE_TIMEOUT = Duration.ofSeconds(10);

  private static final ScrapeArguments DEFAULTS = new ScrapeArguments(
      List.of(),
      List.of(),
      "",
      false,
      true,
      Map.of(),
      DEFAULT_SCRAPE_INTERVAL,
      DEFAULT_SCRAPE_TIMEOUT,
      DEFAULT_METRICS_PATH,
      DEFAULT_SCHEME,
      0L,
      0L,
      0L,
      0L,
      0L,
      0L,
      HttpClientConfig.defaults(),
      false);

  public ScrapeArguments {
    targets = targets == null ? List.of() : List.copyOf(targets);
    forwardTo = forwardTo == null ? List.of() : List.copyOf(forwardTo);
    jobName = jobName == null ? "" : jobName;
    params = copyParams(params);
    Objects.requireNonNull(scrapeInterval, "scrapeInterval");
    Objects.requireNonNull(scrapeTimeout, "scrapeTimeout");
    Objects.requireNonNull(metricsPath, "metricsPath");
    Objects.requireNonNull(scheme, "scheme");
    httpClientConfig = httpClientConfig == null ? HttpClientConfig.defaults() : httpClientConfig;
  }

  public static ScrapeArguments defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder(DEFAULTS);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  private static Map<String, List<String>> copyParams(Map<String, List<String>> params) {
    if (params == null || params.isEmpty()) {
      return Map.of();
    }
    Map<String, List<String>> copy = new LinkedHashMap<>();
    params.forEach((key, values) -> copy.put(
        Objects.requireNonNull(key, "param name"),
        values == null ? List.of() : List.copyOf(new ArrayList<>(values))));
    return Collections.unmodifiableMap(copy);
  }

  public static final class Builder {

    private List<DiscoveryTarget> targets;
    private List<SampleReceiver> forwardTo;
    private String jobName;
    private boolean honorLabels;
    private boolean honorTimestamps;
    private Map<String, List<String>> params;
    private Duration scrapeInterval;
    private Duration scrapeTimeout;
    private String metricsPath;
    private String scheme;
    private long bodySizeLimit;
    private long sampleLimit;
    private long targetLimit;
    private long labelLimit;
    private long labelNameLengthLimit;
    private long labelValueLengthLimit;
    private HttpClientConfig httpClientConfig;
    private boolean extraMetrics;

    private Builder(ScrapeArguments source) {
      this.targets = source.targets();
      this.forwardTo = source.forwardTo();
      this.jobName = source.jobName();
      this.honorLabels = source.honorLabels();
      this.honorTimestamps = source.honorTimestamps();
      this.params = source.params();
      this.scrapeInterval = source.scrapeInterval();
      this.scrapeTimeout = source.scrapeTimeout();
      this.metricsPath = source.metricsPath();
      this.scheme = source.scheme();
      this.bodySizeLimit = source.bodySizeLimit();
      this.sampleLimit = source.sampleLimit();
      this.targetLimit = source.targetLimit();
      this.labelLimit = source.labelLimit();
      this.labelNameLengthLimit = source.labelNameLengthLimit();
      this.labelValueLengthLimit = source.labelValueLengthLimit();
      this.httpClientConfig = source.httpClientConfig();
      this.extraMetrics = source.extraMetrics();
    }

    public Builder targets(List<DiscoveryTarget> targets) {
      this.targets = targets;
      return this;
    }

    public Builder targets(DiscoveryTarget... targets) {
      this.targets = List.of(targets);
      return this;
    }

    public Builder forwardTo(List<? extends SampleReceiver> forwardTo) {
      this.forwardTo = forwardTo == null ? null : List.copyOf(forwardTo);
      return this;
    }

    public Builder jobName(String jobName) {
      this.jobName = jobName;
      return this;
    }

    public Builder honorLabels(boolean honorLabels) {
      this.honorLabels = honorLabels;
      return this;
    }

    public Builder honorTimestamps(boolean honorTimestamps) {
      this.honorTimestamps = honorTimestamps;
      return this;
    }

    public Builder params(Map<String, List<String>> params) {
      this.params = params;
      return this;
    }

    public Builder scrapeInterval(Duration scrapeInterval) {
      this.scrapeInterval = scrapeInterval;
      return this;
    }

    public Builder scrapeTimeout(Duration scrapeTimeout) {
      this.scrapeTimeout = scrapeTimeout;
      return this;
    }

    public Builder metricsPath(String metricsPath) {
      this.metricsPath = metricsPath;
      return this;
    }

    public Builder scheme(String scheme) {
      this.scheme = scheme;
      return this;
    }

    public Builder bodySizeLimit(long bodySizeLimit) {
      this.bodySizeLimit = bodySizeLimit;
      return this;
    }

    public Builder sampleLimit(long sampleLimit) {
      this.sampleLimit = sampleLimit;
      return this;
    }

    public Builder targetLimit(long targetLimit) {
      this.targetLimit = targetLimit;
      return this;
    }

    public Builder labelLimit(long labelLimit) {
      this.labelLimit = labelLimit;
      return this;
    }

    public Builder labelNameLengthLimit(long labelNameLengthLimit) {
      this.labelNameLengthLimit = labelNameLengthLimit;
      return this;
    }

    public Builder labelValueLengthLimit(long labelValueLengthLimit) {
      this.labelValueLengthLimit = labelValueLengthLimit;
      return this;
    }

    public Builder httpClientConfig(HttpClientConfig httpClientConfig) {
      this.httpClientConfig = httpClientConfig;
      return this;
    }

    public Builder extraMetrics(boolean extraMetrics) {
      this.extraMetrics = extraMetrics;
      return this;
    }

    public ScrapeArguments build() {
      return new ScrapeArguments(targets, forwardTo, jobName, honorLabels, honorTimestamps, params, scrapeInterval,
          scrapeTimeout, metricsPath, scheme, bodySizeLimit, sampleLimit, targetLimit, labelLimit,
          labelNameLengthLimit, labelValueLengthLimit, httpClientConfig, extraMetrics);
    }
  }
}
