package org.itinera.planning.model;

import lombok.Builder;
import lombok.Value;

/**
 * One place to visit during a trip.
 *
 * <p>At least one of {@code coordinates}, {@code address} or {@code placeId} is needed
 * for the location to be resolvable. Instances are immutable; resolution produces an
 * enriched copy through {@link #withCoordinates(GeoPoint)}.</p>
 */
@Value
@Builder(toBuilder = true)
public class VisitLocation {
    /** Name, unique within one planning request. */
    String name;
    /** Free-form address for geocoding. */
    String address;
    /** Known coordinates; skips collaborator calls when present. */
    GeoPoint coordinates;
    /** External place reference for place-details lookup. */
    String placeId;
    /** Time spent on site, in minutes. */
    int visitDurationMinutes;
    /** Preferred arrival time as {@code HH:MM}; informational. */
    String preferredTime;
    /** Visit priority; {@link Priority#MEDIUM} when null. */
    Priority priority;
    /** Free-form notes. */
    String notes;

    /**
     * Priority with the default applied.
     */
    public Priority effectivePriority() {
        return Priority.orDefault(priority);
    }

    /**
     * Returns a copy carrying resolved coordinates.
     */
    public VisitLocation withCoordinates(GeoPoint resolved) {
        return toBuilder().coordinates(resolved).build();
    }
}
