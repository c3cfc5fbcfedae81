package org.itinera.planning;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.itinera.planning.model.TripConstraints;
import org.itinera.planning.model.Vehicle;
import org.itinera.planning.model.VisitLocation;

import java.util.List;

/**
 * Client-facing trip planning request.
 */
@Value
@Builder
public class TripPlanRequest {
    /** Locations to visit; names must be unique. Input order breaks priority ties. */
    @Singular
    List<VisitLocation> locations;
    Vehicle vehicle;
    TripConstraints constraints;
    /** ISO date of day 1; optional. */
    String date;
}
