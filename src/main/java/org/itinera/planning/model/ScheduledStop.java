package org.itinera.planning.model;

import lombok.Value;

/**
 * One stop of a linear schedule.
 *
 * <p>Times are minutes since midnight of the first day and are never wrapped, so
 * values past {@code 1440} mark overflow rather than an early-morning time.</p>
 */
@Value
public class ScheduledStop {
    VisitLocation location;
    /** Travel from the previous stop; {@code 0} for the first stop. */
    int travelTimeMinutes;
    /** Distance from the previous stop; {@code 0} for the first stop. */
    double distanceKm;
    int arrivalMinutes;
    int departureMinutes;

    /**
     * Time this stop adds to a day: travel to it plus time on site.
     */
    public int requiredMinutes() {
        return travelTimeMinutes + location.getVisitDurationMinutes();
    }
}
