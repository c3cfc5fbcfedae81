package org.itinera.planning;

import org.itinera.planning.model.TripConstraints;
import org.itinera.planning.model.TripPlan;
import org.itinera.planning.model.Vehicle;
import org.itinera.planning.model.VisitLocation;

import java.util.List;

/**
 * Public trip planning API.
 */
public interface PlannerService {
    /**
     * Plans one trip request.
     *
     * @param request planning request.
     * @return trip plan.
     * @throws TripPlanningException when request contracts fail or a location cannot be resolved.
     */
    TripPlan plan(TripPlanRequest request);

    /**
     * Convenience form of {@link #plan(TripPlanRequest)}.
     *
     * @param date ISO date of day 1, or {@code null}.
     */
    default TripPlan planTrip(
            List<VisitLocation> locations,
            Vehicle vehicle,
            TripConstraints constraints,
            String date
    ) {
        return plan(TripPlanRequest.builder()
                .locations(locations == null ? List.of() : locations)
                .vehicle(vehicle)
                .constraints(constraints)
                .date(date)
                .build());
    }
}
