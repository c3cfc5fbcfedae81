package org.itinera.planning.schedule;

import org.itinera.core.time.TimeUtils;
import org.itinera.planning.TripPlanningException;
import org.itinera.planning.matrix.TravelMatrix;
import org.itinera.planning.model.ScheduledStop;
import org.itinera.planning.model.TripConstraints;
import org.itinera.planning.model.VisitLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks an ordered route and assigns arrival/departure minutes.
 *
 * <p>The first stop arrives at the window start with no travel. Every later stop arrives
 * at the previous departure plus matrix travel time and departs after its visit duration.
 * Minutes are not wrapped at midnight; a timeline past {@code Integer.MAX_VALUE} minutes
 * fails with {@link #REASON_SCHEDULE_OVERFLOW}.</p>
 */
public final class ScheduleBuilder {
    public static final String REASON_SCHEDULE_OVERFLOW = "TP_SCHEDULE_OVERFLOW";

    /**
     * Builds the linear (single-timeline) schedule.
     *
     * @param locations resolved locations; index {@code i} is matrix row {@code i}.
     * @param visitOrder permutation of location indices in visit order.
     * @param matrix travel matrix aligned with {@code locations}.
     * @param constraints constraints supplying the start time.
     * @return one stop per entry of {@code visitOrder}.
     */
    public List<ScheduledStop> build(
            List<VisitLocation> locations,
            int[] visitOrder,
            TravelMatrix matrix,
            TripConstraints constraints
    ) {
        int currentMinutes = TimeUtils.parseClockMinutes(constraints.getStartTime());
        List<ScheduledStop> schedule = new ArrayList<>(visitOrder.length);

        for (int position = 0; position < visitOrder.length; position++) {
            int index = visitOrder[position];
            VisitLocation location = locations.get(index);
            int travelMinutes = 0;
            double distanceKm = 0.0d;
            try {
                if (position > 0) {
                    int previous = visitOrder[position - 1];
                    travelMinutes = matrix.travelMinutes(previous, index);
                    distanceKm = matrix.distanceKm(previous, index);
                    currentMinutes = Math.addExact(currentMinutes, travelMinutes);
                }
                int departure = Math.addExact(currentMinutes, location.getVisitDurationMinutes());
                schedule.add(new ScheduledStop(location, travelMinutes, distanceKm, currentMinutes, departure));
                currentMinutes = departure;
            } catch (ArithmeticException ex) {
                throw new TripPlanningException(
                        REASON_SCHEDULE_OVERFLOW,
                        "schedule minutes overflow at location " + location.getName(),
                        ex
                );
            }
        }
        return schedule;
    }
}
