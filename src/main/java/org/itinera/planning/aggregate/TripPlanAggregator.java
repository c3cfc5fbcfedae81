package org.itinera.planning.aggregate;

import org.itinera.core.id.IDMapper;
import org.itinera.planning.matrix.MatrixSource;
import org.itinera.planning.model.DayPlan;
import org.itinera.planning.model.TripConstraints;
import org.itinera.planning.model.TripPlan;
import org.itinera.planning.model.VisitLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges day plans into the trip-level result.
 *
 * <p>Advisory notes are descriptive only and never change feasibility.</p>
 */
public final class TripPlanAggregator {
    static final String SUGGESTION_EXTEND_TRIP = "Consider extending trip duration or reducing visit times";
    static final String SUGGESTION_GROUP_BY_PROXIMITY = "Consider grouping locations by geographic proximity";

    private final int travelAdvisoryThresholdMinutes;

    /**
     * @param travelAdvisoryThresholdMinutes average daily travel above which regrouping is suggested.
     */
    public TripPlanAggregator(int travelAdvisoryThresholdMinutes) {
        this.travelAdvisoryThresholdMinutes = travelAdvisoryThresholdMinutes;
    }

    /**
     * Builds the trip plan.
     *
     * @param dayPlans day plans in order.
     * @param requestedLocations every location of the request, resolved or not.
     * @param constraints trip constraints.
     * @param matrixSource origin of the travel times.
     * @return aggregated trip plan.
     */
    public TripPlan aggregate(
            List<DayPlan> dayPlans,
            List<VisitLocation> requestedLocations,
            TripConstraints constraints,
            MatrixSource matrixSource
    ) {
        List<VisitLocation> unvisited = unvisited(dayPlans, requestedLocations);

        double totalDistanceKm = 0.0d;
        int totalMinutes = 0;
        int totalTravelMinutes = 0;
        for (DayPlan dayPlan : dayPlans) {
            totalDistanceKm += dayPlan.getTotalDistanceKm();
            totalMinutes += dayPlan.getTotalTravelTimeMinutes() + dayPlan.getTotalVisitTimeMinutes();
            totalTravelMinutes += dayPlan.getTotalTravelTimeMinutes();
        }

        boolean feasibleInSingleDay = dayPlans.size() == 1 && dayPlans.get(0).isFeasible();
        TripPlan.TripPlanBuilder plan = TripPlan.builder()
                .feasibleInSingleDay(feasibleInSingleDay)
                .recommendedDays(dayPlans.size())
                .dayPlans(dayPlans)
                .totalDistanceKm(Math.round(totalDistanceKm * 10.0d) / 10.0d)
                .totalTimeHours(Math.round(totalMinutes / 60.0d * 10.0d) / 10.0d)
                .unvisitedLocations(unvisited)
                .matrixSource(matrixSource);

        if (!feasibleInSingleDay && !dayPlans.isEmpty()) {
            plan.optimizationNote("Trip requires " + dayPlans.size() + " days to complete comfortably");
        }
        if (!unvisited.isEmpty()) {
            plan.optimizationNote(unvisited.size() + " locations could not be scheduled");
            plan.alternativeSuggestion(SUGGESTION_EXTEND_TRIP);
        }
        if (!dayPlans.isEmpty()
                && (double) totalTravelMinutes / dayPlans.size() > travelAdvisoryThresholdMinutes) {
            plan.alternativeSuggestion(SUGGESTION_GROUP_BY_PROXIMITY);
        }
        Integer breakMinutes = constraints.getBreakDurationMinutes();
        if (breakMinutes != null && breakMinutes > 0) {
            plan.optimizationNote("Break of " + breakMinutes + " minutes is not factored into the schedule");
        }
        return plan.build();
    }

    private static List<VisitLocation> unvisited(List<DayPlan> dayPlans, List<VisitLocation> requestedLocations) {
        List<String> visitedNames = new ArrayList<>();
        for (DayPlan dayPlan : dayPlans) {
            for (VisitLocation location : dayPlan.getLocations()) {
                visitedNames.add(location.getName());
            }
        }
        IDMapper visited = IDMapper.fromOrderedNames(visitedNames);

        List<VisitLocation> unvisited = new ArrayList<>();
        for (VisitLocation location : requestedLocations) {
            if (!visited.containsExternal(location.getName())) {
                unvisited.add(location);
            }
        }
        return unvisited;
    }
}
