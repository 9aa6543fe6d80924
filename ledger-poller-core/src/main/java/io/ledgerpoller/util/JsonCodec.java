package io.ledgerpoller.util;

import java.util.Map;

/**
 * Codec for flat {@code Map<String, String>} objects to and from JSON, used to render
 * filter criteria canonically and to read filters from configuration.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and only
 * understands flat objects whose values are strings. Entries are written in the map's
 * iteration order, so callers that need a canonical rendering pass a sorted map.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a string map as a JSON object. An empty map encodes as {@code {}}.
     *
     * @param values the entries to encode
     * @return JSON object string
     * @throws IllegalArgumentException if the map contains a null key
     */
    String toJson(Map<String, String> values);

    /**
     * Parses a flat JSON object into an insertion-ordered map. {@code null} members are skipped.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null}); empty for {@code null} or blank input
     * @throws IllegalArgumentException if the input is not a flat JSON object of strings
     */
    Map<String, String> parseObject(String json);
}
