package io.scrapehive.supervisor.spring;

import io.scrapehive.supervisor.config.DiscoveryTarget;
import io.scrapehive.supervisor.config.HttpClientConfig;
import io.scrapehive.supervisor.config.ScrapeArguments;
import io.scrapehive.supervisor.ports.SampleReceiver;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Binds {@code scrapehive.scrape.*} into the arguments of a single scrape supervisor.
 * Settings left unset fall back to {@link ScrapeArguments#defaults()}.
 */
@Validated
@ConfigurationProperties(prefix = "scrapehive.scrape")
public final class ScrapeSupervisorProperties {

    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final boolean enabled;
    private final String instanceId;
    private final List<DiscoveryTarget> targets;
    private final String jobName;
    private final Boolean honorLabels;
    private final Boolean honorTimestamps;
    private final Map<String, List<String>> params;
    private final Duration scrapeInterval;
    private final Duration scrapeTimeout;
    private final String metricsPath;
    private final String scheme;
    private final DataSize bodySizeLimit;
    private final Limits limits;
    private final boolean extraMetrics;
    private final HttpClient httpClient;
    private final Duration shutdownTimeout;

    public ScrapeSupervisorProperties(Boolean enabled,
                                      String instanceId,
                                      List<String> addresses,
                                      List<Map<String, String>> targets,
                                      String jobName,
                                      Boolean honorLabels,
                                      Boolean honorTimestamps,
                                      Map<String, List<String>> params,
                                      Duration scrapeInterval,
                                      Duration scrapeTimeout,
                                      String metricsPath,
                                      String scheme,
                                      DataSize bodySizeLimit,
                                      @Valid Limits limits,
                                      Boolean extraMetrics,
                                      @Valid HttpClient httpClient,
                                      Duration shutdownTimeout) {
        this.enabled = enabled == null || enabled;
        this.instanceId = requireNonBlank(instanceId, "scrapehive.scrape.instance-id");
        this.targets = bindTargets(addresses, targets);
        this.jobName = jobName;
        this.honorLabels = honorLabels;
        this.honorTimestamps = honorTimestamps;
        this.params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.scrapeInterval = scrapeInterval;
        this.scrapeTimeout = scrapeTimeout;
        this.metricsPath = metricsPath;
        this.scheme = scheme;
        this.bodySizeLimit = bodySizeLimit;
        this.limits = limits != null ? limits : new Limits(null, null, null, null, null);
        this.extraMetrics = extraMetrics != null && extraMetrics;
        this.httpClient = httpClient != null ? httpClient : new HttpClient(null, null, null, null, null, null, null, null, null);
        this.shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
        if (this.shutdownTimeout.isNegative() || this.shutdownTimeout.isZero()) {
            throw new IllegalArgumentException("scrapehive.scrape.shutdown-timeout must be positive");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public List<DiscoveryTarget> getTargets() {
        return targets;
    }

    public Limits getLimits() {
        return limits;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Resolve the bound settings against the defaults. Validation of the combined
     * result happens when the supervisor applies it.
     */
    public ScrapeArguments toArguments(List<? extends SampleReceiver> receivers) {
        ScrapeArguments defaults = ScrapeArguments.defaults();
        ScrapeArguments.Builder builder = ScrapeArguments.builder()
            .targets(targets)
            .forwardTo(receivers == null ? List.of() : receivers)
            .params(params)
            .extraMetrics(extraMetrics)
            .httpClientConfig(httpClient.toConfig());
        if (jobName != null) {
            builder.jobName(jobName);
        }
        builder.honorLabels(honorLabels != null ? honorLabels : defaults.honorLabels());
        builder.honorTimestamps(honorTimestamps != null ? honorTimestamps : defaults.honorTimestamps());
        builder.scrapeInterval(scrapeInterval != null ? scrapeInterval : defaults.scrapeInterval());
        builder.scrapeTimeout(scrapeTimeout != null ? scrapeTimeout : defaults.scrapeTimeout());
        builder.metricsPath(metricsPath != null ? metricsPath : defaults.metricsPath());
        builder.scheme(scheme != null ? scheme : defaults.scheme());
        builder.bodySizeLimit(bodySizeLimit != null ? bodySizeLimit.toBytes() : defaults.bodySizeLimit());
        builder.sampleLimit(limits.sample());
        builder.targetLimit(limits.target());
        builder.labelLimit(limits.label());
        builder.labelNameLengthLimit(limits.labelNameLength());
        builder.labelValueLengthLimit(limits.labelValueLength());
        return builder.build();
    }

    private static List<DiscoveryTarget> bindTargets(List<String> addresses, List<Map<String, String>> targets) {
        List<DiscoveryTarget> bound = new ArrayList<>();
        if (addresses != null) {
            for (int i = 0; i < addresses.size(); i++) {
                bound.add(DiscoveryTarget.ofAddress(
                    requireNonBlank(addresses.get(i), "scrapehive.scrape.addresses[" + i + "]")));
            }
        }
        if (targets != null) {
            for (int i = 0; i < targets.size(); i++) {
                Map<String, String> labels = targets.get(i);
                if (labels == null || labels.isEmpty()) {
                    throw new IllegalArgumentException("scrapehive.scrape.targets[" + i + "] must define at least one label");
                }
                bound.add(DiscoveryTarget.of(labels));
            }
        }
        return List.copyOf(bound);
    }

    private static String requireNonBlank(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must not be null or blank");
        }
        return value;
    }

    /**
     * Per-scrape limits; {@code 0} means unlimited.
     */
    public record Limits(Long sample, Long target, Long label, Long labelNameLength, Long labelValueLength) {

        public Limits {
            sample = nonNegative(sample, "sample");
            target = nonNegative(target, "target");
            label = nonNegative(label, "label");
            labelNameLength = nonNegative(labelNameLength, "label-name-length");
            labelValueLength = nonNegative(labelValueLength, "label-value-length");
        }

        private static Long nonNegative(Long value, String name) {
            if (value == null) {
                return 0L;
            }
            if (value < 0) {
                throw new IllegalArgumentException(
                    "scrapehive.scrape.limits." + name + " must not be negative, but was " + value);
            }
            return value;
        }
    }

    public record HttpClient(
        HttpClientConfig.BasicAuth basicAuth,
        HttpClientConfig.Authorization authorization,
        String bearerToken,
        String bearerTokenFile,
        HttpClientConfig.OAuth2 oauth2,
        HttpClientConfig.TlsConfig tls,
        String proxyUrl,
        Boolean followRedirects,
        Boolean enableHttp2
    ) {

        HttpClientConfig toConfig() {
            HttpClientConfig defaults = HttpClientConfig.defaults();
            return HttpClientConfig.builder()
                .basicAuth(basicAuth)
                .authorization(authorization)
                .bearerToken(bearerToken)
                .bearerTokenFile(bearerTokenFile)
                .oauth2(oauth2)
                .tls(tls != null ? tls : HttpClientConfig.TlsConfig.none())
                .proxyUrl(proxyUrl)
                .followRedirects(followRedirects != null ? followRedirects : defaults.followRedirects())
                .enableHttp2(enableHttp2 != null ? enableHttp2 : defaults.enableHttp2())
                .build();
        }
    }
}
