package io.ledgerpoller.spring.boot;

import io.ledgerpoller.EventFilter;
import io.ledgerpoller.LedgerEvent;
import io.ledgerpoller.poller.EventBatchListener;
import io.ledgerpoller.poller.EventPoller;
import io.ledgerpoller.poller.PollerErrorHandler;
import io.ledgerpoller.spi.EventQueryClient;
import io.ledgerpoller.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for the ledger event poller.
 *
 * <p>Wires up an {@link EventPoller} from the application's {@link EventQueryClient} bean and
 * {@link LedgerPollerProperties}. Every {@link EventBatchListener} bean receives each batch, in
 * bean order. A {@link PollerErrorHandler} bean and a {@link MetricsExporter} bean are used when
 * present.
 *
 * @see LedgerPollerProperties
 * @see LedgerPollerMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(EventPoller.class)
@ConditionalOnBean(EventQueryClient.class)
@ConditionalOnProperty(prefix = "ledger-poller", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LedgerPollerProperties.class)
public class LedgerPollerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventPoller eventPoller(LedgerPollerProperties props,
                                   EventQueryClient client,
                                   ObjectProvider<EventBatchListener> listenerProvider,
                                   ObjectProvider<PollerErrorHandler> errorHandlerProvider,
                                   ObjectProvider<MetricsExporter> metricsProvider) {
        List<EventFilter> filters = parseFilters(props.getFilters());
        List<EventBatchListener> listeners = listenerProvider.orderedStream().toList();

        var builder = EventPoller.builder()
                .client(client)
                .filters(filters)
                .intervalMs(props.getIntervalMs())
                .startFromNow(props.isStartFromNow())
                .memoryWindowMs(props.getMemoryWindow().toMillis())
                .maxStoredEvents(props.getMaxStoredEvents())
                .queryTimeoutMs(props.getQueryTimeout().toMillis())
                .onNewEvents(fanOut(listeners));

        PollerErrorHandler errorHandler = errorHandlerProvider.getIfAvailable();
        if (errorHandler != null) {
            builder.onError(errorHandler);
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }

        EventPoller poller = builder.build();
        if (props.isAutoStart()) {
            poller.start();
        }
        return poller;
    }

    private static List<EventFilter> parseFilters(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            throw new IllegalStateException("ledger-poller.filters must contain at least one filter");
        }
        List<EventFilter> filters = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            try {
                filters.add(EventFilter.fromJson(configured.get(i)));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid ledger-poller.filters[" + i + "]: " + e.getMessage(), e);
            }
        }
        return filters;
    }

    /**
     * Hands each batch to every listener. A throwing listener does not keep later ones from
     * running; the first failure is rethrown with the rest suppressed.
     */
    static EventBatchListener fanOut(List<EventBatchListener> listeners) {
        if (listeners.isEmpty()) {
            return EventBatchListener.NOOP;
        }
        if (listeners.size() == 1) {
            return listeners.get(0);
        }
        List<EventBatchListener> copy = List.copyOf(listeners);
        return (List<LedgerEvent> events) -> {
            RuntimeException first = null;
            for (EventBatchListener listener : copy) {
                try {
                    listener.onNewEvents(events);
                } catch (RuntimeException e) {
                    if (first == null) first = e;
                    else first.addSuppressed(e);
                }
            }
            if (first != null) throw first;
        };
    }
}
