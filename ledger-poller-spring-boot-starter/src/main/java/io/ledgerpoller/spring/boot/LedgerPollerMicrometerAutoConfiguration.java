package io.ledgerpoller.spring.boot;

import io.ledgerpoller.micrometer.MicrometerMetricsExporter;
import io.ledgerpoller.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code ledger-poller.metrics.enabled} is true (default).
 *
 * <p>Runs after the actuator's registry auto-configuration, so its {@link MeterRegistry} is
 * visible, and before {@link LedgerPollerAutoConfiguration}, so the {@link MetricsExporter}
 * bean is available for injection into the poller.
 */
@AutoConfiguration(before = LedgerPollerAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "ledger-poller.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LedgerPollerProperties.class)
public class LedgerPollerMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, LedgerPollerProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
