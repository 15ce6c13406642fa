package com.puzzlenft.puzzleservice.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered key/value metadata persisted with an asset. Keys are unique and order is preserved.
 * Instances are immutable; {@link #withUpdates(Map)} returns a new list.
 */
public final class AttributeList {

    private static final AttributeList EMPTY = new AttributeList(List.of());

    private final List<Attribute> attributes;

    private AttributeList(List<Attribute> attributes) {
        this.attributes = attributes;
    }

    public static AttributeList empty() {
        return EMPTY;
    }

    /**
     * Build a list from pairs in order, rejecting duplicate or blank keys.
     */
    public static AttributeList of(List<Attribute> attributes) {
        Set<String> seen = new HashSet<>();
        for (Attribute attribute : attributes) {
            if (attribute.getKey() == null || attribute.getKey().isBlank()) {
                throw new IllegalArgumentException("Attribute key must not be blank");
            }
            if (attribute.getValue() == null) {
                throw new IllegalArgumentException("Attribute value must not be null: " + attribute.getKey());
            }
            if (!seen.add(attribute.getKey())) {
                throw new IllegalArgumentException("Duplicate attribute key: " + attribute.getKey());
            }
        }
        return new AttributeList(List.copyOf(attributes));
    }

    public Optional<String> get(String key) {
        for (Attribute attribute : attributes) {
            if (attribute.getKey().equals(key)) {
                return Optional.of(attribute.getValue());
            }
        }
        return Optional.empty();
    }

    public boolean containsKey(String key) {
        return get(key).isPresent();
    }

    /**
     * Replace the value of each updated key in place, appending keys that are not present yet.
     * Pairs not named in {@code updates} keep their value and position.
     */
    public AttributeList withUpdates(Map<String, String> updates) {
        List<Attribute> merged = new ArrayList<>(attributes);
        for (Map.Entry<String, String> update : updates.entrySet()) {
            Attribute replacement = new Attribute(update.getKey(), update.getValue());
            int index = indexOf(merged, update.getKey());
            if (index >= 0) {
                merged.set(index, replacement);
            } else {
                merged.add(replacement);
            }
        }
        return of(merged);
    }

    private static int indexOf(List<Attribute> list, String key) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).getKey().equals(key)) {
                return i;
            }
        }
        return -1;
    }

    public List<Attribute> asList() {
        return Collections.unmodifiableList(attributes);
    }

    public List<String> keys() {
        return attributes.stream().map(Attribute::getKey).toList();
    }

    public int size() {
        return attributes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return attributes.equals(((AttributeList) o).attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    @Override
    public String toString() {
        return attributes.toString();
    }
}
