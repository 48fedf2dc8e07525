package com.example.reconcile.model;

import java.util.Comparator;

/**
 * Groups records describing the same real-world entity, e.g. {@code POLICY:PLZ-RCA-77821}.
 */
public record EntityKey(EntityKind kind, String value) implements Comparable<EntityKey> {

    private static final Comparator<EntityKey> ORDER = Comparator
            .comparing(EntityKey::kind)
            .thenComparing(EntityKey::value);

    @Override
    public int compareTo(EntityKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
