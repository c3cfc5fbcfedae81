package org.itinera.planning.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Visit priority.
 *
 * <p>{@code rank} orders the optimizer seed list (higher first). {@code travelBonus}
 * multiplies travel time when choosing the next stop; smaller is more attractive.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum Priority {
    HIGH(3, 0.8d),
    MEDIUM(2, 0.9d),
    LOW(1, 1.0d);

    private final int rank;
    private final double travelBonus;

    /**
     * Returns {@code priority}, or {@link #MEDIUM} when absent.
     */
    public static Priority orDefault(Priority priority) {
        return priority == null ? MEDIUM : priority;
    }
}
