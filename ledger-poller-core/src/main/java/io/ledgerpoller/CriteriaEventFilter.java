package io.ledgerpoller;

import io.ledgerpoller.util.JsonCodec;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * {@link EventFilter} made of flat string criteria. The canonical form is the criteria
 * rendered as a JSON object with keys in natural order.
 *
 * <p>Create instances via {@link EventFilter#of(Map)} or {@link EventFilter#fromJson(String)}.
 */
public final class CriteriaEventFilter implements EventFilter {
    private final SortedMap<String, String> criteria;
    private final String canonicalForm;

    CriteriaEventFilter(Map<String, String> criteria) {
        Objects.requireNonNull(criteria, "criteria");
        if (criteria.isEmpty()) {
            throw new IllegalArgumentException("criteria cannot be empty");
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, String> entry : criteria.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty()) {
                throw new IllegalArgumentException("criteria cannot contain null or empty names");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("criterion " + entry.getKey() + " has a null value");
            }
            sorted.put(entry.getKey(), entry.getValue());
        }
        this.criteria = Collections.unmodifiableSortedMap(sorted);
        this.canonicalForm = JsonCodec.getDefault().toJson(this.criteria);
    }

    /**
     * Returns the criteria, sorted by name.
     *
     * @return unmodifiable criteria map
     */
    public SortedMap<String, String> criteria() {
        return criteria;
    }

    @Override
    public String canonicalForm() {
        return canonicalForm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CriteriaEventFilter other)) return false;
        return canonicalForm.equals(other.canonicalForm);
    }

    @Override
    public int hashCode() {
        return canonicalForm.hashCode();
    }

    @Override
    public String toString() {
        return canonicalForm;
    }
}
