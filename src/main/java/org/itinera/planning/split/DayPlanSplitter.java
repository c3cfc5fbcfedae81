package org.itinera.planning.split;

import org.itinera.core.time.TimeUtils;
import org.itinera.planning.model.DayPlan;
import org.itinera.planning.model.RouteSegment;
import org.itinera.planning.model.ScheduledStop;
import org.itinera.planning.model.TripConstraints;
import org.itinera.planning.model.VisitLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Partitions a linear schedule into days bounded by the daily window.
 *
 * <p>Each stop needs {@code travel + visit} minutes. A stop that would push a non-empty
 * day past the window closes that day and opens the next one. A stop that alone exceeds
 * the window is still admitted to its (empty) day, which is then reported infeasible.
 * Stops are never dropped.</p>
 *
 * <p>Clock times inside a day are the schedule's arrival and departure minutes shifted
 * by a per-day offset, so every day starts at {@code startTime}. The offset is taken from
 * the day's first stop, which keeps the travel minutes it had in the linear schedule;
 * day 1 has offset zero.</p>
 */
public final class DayPlanSplitter {
    static final String SUGGESTION_REDUCE_OR_SPLIT = "Consider reducing visit durations or splitting into more days";

    /**
     * Splits the schedule.
     *
     * @param schedule linear schedule in visit order.
     * @param constraints window and optional per-day limits.
     * @param date ISO date of day 1, or {@code null}.
     * @return day plans in order, day index starting at 1.
     */
    public List<DayPlan> split(List<ScheduledStop> schedule, TripConstraints constraints, String date) {
        int startMinutes = TimeUtils.parseClockMinutes(constraints.getStartTime());
        int windowMinutes = TimeUtils.parseClockMinutes(constraints.getEndTime()) - startMinutes;

        List<DayPlan> dayPlans = new ArrayList<>();
        DayAccumulator current = new DayAccumulator(1, startMinutes);
        for (ScheduledStop stop : schedule) {
            int required = stop.requiredMinutes();
            if (current.elapsedMinutes + required > windowMinutes && !current.isEmpty()) {
                dayPlans.add(current.close(windowMinutes, constraints, date));
                current = new DayAccumulator(current.day + 1, startMinutes);
            }
            current.admit(stop);
        }
        if (!current.isEmpty()) {
            dayPlans.add(current.close(windowMinutes, constraints, date));
        }
        return dayPlans;
    }

    /**
     * Mutable state of the day being filled.
     */
    private static final class DayAccumulator {
        private final int day;
        private final int startMinutes;
        private final List<VisitLocation> locations = new ArrayList<>();
        private final List<RouteSegment> segments = new ArrayList<>();
        private int elapsedMinutes;
        private int visitMinutes;
        private double distanceKm;
        private ScheduledStop previous;
        private int scheduleOffsetMinutes;

        private DayAccumulator(int day, int startMinutes) {
            this.day = day;
            this.startMinutes = startMinutes;
        }

        private boolean isEmpty() {
            return locations.isEmpty();
        }

        private void admit(ScheduledStop stop) {
            VisitLocation location = stop.getLocation();
            if (previous == null) {
                scheduleOffsetMinutes = stop.getArrivalMinutes() - stop.getTravelTimeMinutes() - startMinutes;
            } else {
                segments.add(RouteSegment.builder()
                        .from(previous.getLocation())
                        .to(location)
                        .distanceKm(stop.getDistanceKm())
                        .travelTimeMinutes(stop.getTravelTimeMinutes())
                        .departureTime(TimeUtils.formatClock(previous.getDepartureMinutes() - scheduleOffsetMinutes))
                        .arrivalTime(TimeUtils.formatClock(stop.getArrivalMinutes() - scheduleOffsetMinutes))
                        .build());
                distanceKm += stop.getDistanceKm();
            }
            locations.add(location);
            elapsedMinutes += stop.requiredMinutes();
            visitMinutes += location.getVisitDurationMinutes();
            previous = stop;
        }

        private DayPlan close(int windowMinutes, TripConstraints constraints, String date) {
            boolean feasible = elapsedMinutes <= windowMinutes;
            int travelMinutes = elapsedMinutes - visitMinutes;

            DayPlan.DayPlanBuilder plan = DayPlan.builder()
                    .day(day)
                    .date(date == null ? null : TimeUtils.addDays(date, day - 1))
                    .locations(locations)
                    .routeSegments(segments)
                    .totalDistanceKm(Math.round(distanceKm * 10.0d) / 10.0d)
                    .totalTravelTimeMinutes(travelMinutes)
                    .totalVisitTimeMinutes(visitMinutes)
                    .startTime(TimeUtils.formatClock(startMinutes))
                    .endTime(TimeUtils.formatClock(startMinutes + elapsedMinutes))
                    .feasible(feasible);

            if (!feasible) {
                plan.issue("Day exceeds time limit by " + (elapsedMinutes - windowMinutes) + " minutes");
                plan.suggestion(SUGGESTION_REDUCE_OR_SPLIT);
            }
            Double maxDistanceKm = constraints.getMaxTotalDistanceKm();
            if (maxDistanceKm != null && distanceKm > maxDistanceKm) {
                plan.issue(String.format(Locale.ROOT, "Day exceeds distance limit by %.1f km", distanceKm - maxDistanceKm));
            }
            Integer maxTravelMinutes = constraints.getMaxTravelTimeMinutes();
            if (maxTravelMinutes != null && travelMinutes > maxTravelMinutes) {
                plan.issue("Day exceeds travel time limit by " + (travelMinutes - maxTravelMinutes) + " minutes");
            }
            return plan.build();
        }
    }
}
