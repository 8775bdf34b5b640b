package io.scrapehive.supervisor.spring;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.scrapehive.supervisor.fanout.ForwardingFanout;
import io.scrapehive.supervisor.ports.MetricsPort;
import io.scrapehive.supervisor.ports.SampleFanout;
import io.scrapehive.supervisor.ports.SampleReceiver;
import io.scrapehive.supervisor.ports.ScrapeEngineFactory;
import io.scrapehive.supervisor.runtime.ScrapeSupervisor;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.bind.annotation.RestController;

/**
 * Auto-configuration that wires a scrape supervisor around the application's
 * {@link ScrapeEngineFactory}. Every {@link SampleReceiver} bean becomes a forward
 * destination.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(ScrapeSupervisor.class)
@ConditionalOnProperty(prefix = "scrapehive.scrape", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ScrapeSupervisorProperties.class)
public class ScrapeSupervisorAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ScrapeSupervisorAutoConfiguration.class);

    private final ScrapeSupervisorProperties properties;

    ScrapeSupervisorAutoConfiguration(ScrapeSupervisorProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Bean
    @ConditionalOnMissingBean
    SampleFanout scrapeSampleFanout() {
        return new ForwardingFanout();
    }

    @Bean(name = "scrapeSupervisorMetrics", destroyMethod = "close")
    @ConditionalOnMissingBean(MetricsPort.class)
    MetricsPort scrapeSupervisorMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            return MetricsPort.noop();
        }
        return new MicrometerSupervisorMetrics(registry, Tags.of("instance", properties.getInstanceId()));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(ScrapeEngineFactory.class)
    ScrapeSupervisor scrapeSupervisor(ScrapeEngineFactory engineFactory,
                                      SampleFanout fanout,
                                      MetricsPort scrapeSupervisorMetrics,
                                      ObjectProvider<SampleReceiver> receivers) {
        List<SampleReceiver> forwardTo = receivers.orderedStream().toList();
        ScrapeSupervisor supervisor = new ScrapeSupervisor(
            properties.getInstanceId(),
            properties.toArguments(forwardTo),
            engineFactory,
            fanout,
            scrapeSupervisorMetrics);
        log.info("Scrape supervisor {} configured (targets={}, receivers={})",
            properties.getInstanceId(), properties.getTargets().size(), forwardTo.size());
        return supervisor;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ScrapeSupervisor.class)
    ScrapeSupervisorLifecycle scrapeSupervisorLifecycle(ScrapeSupervisor supervisor) {
        return new ScrapeSupervisorLifecycle(supervisor, properties.getShutdownTimeout());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(RestController.class)
    static class StatusEndpointConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(ScrapeSupervisor.class)
        ScrapeStatusController scrapeStatusController(ScrapeSupervisor supervisor) {
            return new ScrapeStatusController(supervisor);
        }
    }
}
