package org.itinera.planning.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One day of a trip.
 *
 * <p>When {@code feasible=false} the day still carries its complete schedule;
 * {@code issues} describe the violation.</p>
 */
@Value
@Builder
public class DayPlan {
    /** 1-based day index. */
    int day;
    /** ISO date of this day, or {@code null} when the trip has no base date. */
    String date;
    @Singular
    List<VisitLocation> locations;
    @Singular("routeSegment")
    List<RouteSegment> routeSegments;
    double totalDistanceKm;
    int totalTravelTimeMinutes;
    int totalVisitTimeMinutes;
    String startTime;
    String endTime;
    boolean feasible;
    @Singular
    List<String> issues;
    @Singular
    List<String> suggestions;
}
