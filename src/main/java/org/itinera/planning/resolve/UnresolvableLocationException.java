package org.itinera.planning.resolve;

import lombok.Getter;
import org.itinera.planning.TripPlanningException;

/**
 * Thrown when no coordinates can be obtained for a location.
 */
@Getter
public final class UnresolvableLocationException extends TripPlanningException {
    public static final String REASON_UNRESOLVABLE_LOCATION = "TP_UNRESOLVABLE_LOCATION";

    private final String locationName;

    public UnresolvableLocationException(String locationName) {
        super(REASON_UNRESOLVABLE_LOCATION, "Could not resolve coordinates for location: " + locationName);
        this.locationName = locationName;
    }
}
