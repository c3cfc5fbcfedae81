package org.itinera.planning.model;

import lombok.Builder;
import lombok.Value;

/**
 * Travel leg between two consecutive stops of one day.
 */
@Value
@Builder
public class RouteSegment {
    VisitLocation from;
    VisitLocation to;
    double distanceKm;
    int travelTimeMinutes;
    /** Departure from {@code from}, {@code HH:MM}. */
    String departureTime;
    /** Arrival at {@code to}, {@code HH:MM}. */
    String arrivalTime;
}
