package io.scrapehive.supervisor.config;

import io.scrapehive.supervisor.engine.ScrapeJobConfig;
import java.util.Objects;

/**
 * Maps supervisor arguments onto the engine's job configuration.
 * <p>
 * Only structural translation happens here. Correctness is judged by
 * {@link ScrapeJobConfig#validate()}, and its failures are reported as
 * {@link ScrapeConfigException.Stage#BUILD} errors.
 */
public final class ScrapeConfigBuilder {

  private ScrapeConfigBuilder() {
  }

  public static ScrapeJobConfig build(String instanceId, ScrapeArguments args) {
    Objects.requireNonNull(instanceId, "instanceId");
    Objects.requireNonNull(args, "args");
    String jobName = args.jobName().isBlank() ? instanceId : args.jobName();
    ScrapeJobConfig config = new ScrapeJobConfig(
        jobName,
        args.honorLabels(),
        args.honorTimestamps(),
        args.params(),
        args.scrapeInterval(),
        args.scrapeTimeout(),
        args.metricsPath(),
        args.scheme(),
        args.bodySizeLimit(),
        args.sampleLimit(),
        args.targetLimit(),
        args.labelLimit(),
        args.labelNameLengthLimit(),
        args.labelValueLengthLimit(),
        args.httpClientConfig());
    try {
      config.validate();
    } catch (IllegalArgumentException ex) {
      throw new ScrapeConfigException(ScrapeConfigException.Stage.BUILD,
          "invalid scrape_config: " + ex.getMessage(), ex);
    }
    return config;
  }
}
