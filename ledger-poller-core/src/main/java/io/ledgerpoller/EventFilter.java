package io.ledgerpoller;

import io.ledgerpoller.util.JsonCodec;

import java.util.Map;

/**
 * Opaque predicate selecting which ledger events a query returns.
 *
 * <p>The poller never interprets a filter; it hands it to the
 * {@linkplain io.ledgerpoller.spi.EventQueryClient query client} and keys its cursor state by
 * {@link #canonicalForm()}. Two filters with the same canonical form share one cursor.
 *
 * <p>The built-in implementation returned by {@link #of(Map)} sorts its criteria by name, so
 * insertion order never changes identity. A custom implementation must produce a stable
 * canonical form itself: if it does not, semantically equal filters whose fields are rendered
 * in different orders are tracked as separate cursors and may deliver the same event twice.
 */
public interface EventFilter {

    /**
     * Returns a serialization of this filter that is identical for identical filters.
     *
     * @return the canonical form, never {@code null}
     */
    String canonicalForm();

    /**
     * Creates a filter with a single criterion, e.g. {@code of("MoveEventType", "0x2::coin::CoinEvent")}.
     *
     * @param criterion criterion name
     * @param value     criterion value
     * @return a new filter
     */
    static EventFilter of(String criterion, String value) {
        return new CriteriaEventFilter(Map.of(criterion, value));
    }

    /**
     * Creates a filter from a flat set of criteria.
     *
     * @param criteria criterion names mapped to values; must not be empty
     * @return a new filter
     * @throws IllegalArgumentException if {@code criteria} is empty or holds null keys or values
     */
    static EventFilter of(Map<String, String> criteria) {
        return new CriteriaEventFilter(criteria);
    }

    /**
     * Parses a filter from a flat JSON object such as {@code {"Sender":"0xabc"}}.
     *
     * @param json the JSON object
     * @return a new filter
     * @throws IllegalArgumentException if the input is not a non-empty flat JSON object
     */
    static EventFilter fromJson(String json) {
        return new CriteriaEventFilter(JsonCodec.getDefault().parseObject(json));
    }
}
