package io.scrapehive.supervisor.engine;

import io.scrapehive.supervisor.config.HttpClientConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative configuration of one scrape job as understood by the engine.
 * <p>
 * Limits use {@code 0} for "unlimited". {@code scrapeTimeout <= scrapeInterval}
 * is left to the caller.
 */
public record ScrapeJobConfig(
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
    HttpClientConfig httpClientConfig
) {

  public ScrapeJobConfig {
    Objects.requireNonNull(jobName, "jobName");
    params = copyParams(params);
    Objects.requireNonNull(scrapeInterval, "scrapeInterval");
    Objects.requireNonNull(scrapeTimeout, "scrapeTimeout");
    Objects.requireNonNull(metricsPath, "metricsPath");
    Objects.requireNonNull(scheme, "scheme");
    Objects.requireNonNull(httpClientConfig, "httpClientConfig");
  }

  /**
   * @throws IllegalArgumentException describing the first invalid setting
   */
  public void validate() {
    if (jobName.isBlank()) {
      throw new IllegalArgumentException("job_name is empty");
    }
    if (!"http".equals(scheme) && !"https".equals(scheme)) {
      throw new IllegalArgumentException("invalid scheme \"" + scheme + "\" for job " + jobName + ", must be http or https");
    }
    if (!metricsPath.startsWith("/")) {
      throw new IllegalArgumentException("metrics_path \"" + metricsPath + "\" for job " + jobName + " must start with /");
    }
    requirePositive(scrapeInterval, "scrape_interval");
    requirePositive(scrapeTimeout, "scrape_timeout");
    requireNonNegative(bodySizeLimit, "body_size_limit");
    requireNonNegative(sampleLimit, "sample_limit");
    requireNonNegative(targetLimit, "target_limit");
    requireNonNegative(labelLimit, "label_limit");
    requireNonNegative(labelNameLengthLimit, "label_name_length_limit");
    requireNonNegative(labelValueLengthLimit, "label_value_length_limit");
    httpClientConfig.validate();
  }

  private void requirePositive(Duration value, String name) {
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " for job " + jobName + " must be positive, but was " + value);
    }
  }

  private void requireNonNegative(long value, String name) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " for job " + jobName + " must not be negative, but was " + value);
    }
  }

  private static Map<String, List<String>> copyParams(Map<String, List<String>> params) {
    if (params == null || params.isEmpty()) {
      return Map.of();
    }
    Map<String, List<String>> copy = new LinkedHashMap<>();
    params.forEach((key, values) -> copy.put(key, values == null ? List.of() : List.copyOf(new ArrayList<>(values))));
    return Collections.unmodifiableMap(copy);
  }
}
