package io.ledgerpoller.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the ledger event poller.
 *
 * <p>Filters are given as flat JSON objects, one per list entry:
 * <pre>{@code
 * ledger-poller:
 *   interval-ms: 3000
 *   filters:
 *     - '{"MoveEventType":"0x2::coin::CoinEvent"}'
 *     - '{"Sender":"0xabc"}'
 *     - '{"MoveModule":"pool","Sender":"0xdee"}'
 * }</pre>
 *
 * <p>Spring splits a single non-indexed list value on commas, so a filter with more than one
 * criterion must be given as a YAML list item (above) or with an explicit index, e.g.
 * {@code ledger-poller.filters[0]={"MoveModule":"pool","Sender":"0xdee"}}. Written as
 * {@code ledger-poller.filters={"MoveModule":"pool","Sender":"0xdee"}} it binds as two broken
 * entries and startup fails.
 *
 * @see LedgerPollerAutoConfiguration
 */
@ConfigurationProperties(prefix = "ledger-poller")
public class LedgerPollerProperties {

    /**
     * Whether to create the poller at all.
     */
    private boolean enabled = true;

    /**
     * Delay between fetch cycles in milliseconds.
     */
    private long intervalMs = 5000;

    /**
     * Skip events that happened before the poller was built.
     */
    private boolean startFromNow = true;

    /**
     * How long a delivered event id is remembered for duplicate suppression.
     */
    private Duration memoryWindow = Duration.ofHours(1);

    /**
     * Maximum number of event ids remembered per filter.
     */
    private int maxStoredEvents = 1000;

    /**
     * Longest time a single filter query may take before it counts as failed.
     */
    private Duration queryTimeout = Duration.ofSeconds(30);

    /**
     * Start polling as soon as the application context is up.
     */
    private boolean autoStart = true;

    /**
     * Event filters, each a flat JSON object of criteria. Use YAML list items or indexed
     * keys for filters with more than one criterion.
     */
    private List<String> filters = new ArrayList<>();

    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }

    public boolean isStartFromNow() {
        return startFromNow;
    }

    public void setStartFromNow(boolean startFromNow) {
        this.startFromNow = startFromNow;
    }

    public Duration getMemoryWindow() {
        return memoryWindow;
    }

    public void setMemoryWindow(Duration memoryWindow) {
        this.memoryWindow = memoryWindow;
    }

    public int getMaxStoredEvents() {
        return maxStoredEvents;
    }

    public void setMaxStoredEvents(int maxStoredEvents) {
        this.maxStoredEvents = maxStoredEvents;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public List<String> getFilters() {
        return filters;
    }

    public void setFilters(List<String> filters) {
        this.filters = filters;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "ledgerpoller";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
