package org.itinera.planning.model;

import lombok.Builder;
import lombok.Value;

/**
 * Daily time window and optional limits for a trip.
 *
 * <p>Times are wall-clock {@code HH:MM}. {@code endTime} must be later than
 * {@code startTime}. Distance and travel-time limits produce advisory day issues only.
 * Break fields are accepted but not applied to the schedule.</p>
 */
@Value
@Builder
public class TripConstraints {
    String startTime;
    String endTime;
    /** Start location override ({@code lat,lng} or address). */
    String startLocation;
    /** End location override ({@code lat,lng} or address). */
    String endLocation;
    Integer maxTravelTimeMinutes;
    Double maxTotalDistanceKm;
    Integer breakDurationMinutes;
    Double breakAfterHours;

    /**
     * Returns constraints with only a daily window.
     */
    public static TripConstraints window(String startTime, String endTime) {
        return TripConstraints.builder()
                .startTime(startTime)
                .endTime(endTime)
                .build();
    }
}
