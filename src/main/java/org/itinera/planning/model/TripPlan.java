package org.itinera.planning.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.itinera.planning.matrix.MatrixSource;

import java.util.List;

/**
 * Planning result for one request.
 */
@Value
@Builder
public class TripPlan {
    /** True only when there is exactly one day and it is feasible. */
    boolean feasibleInSingleDay;
    /** Number of day plans. */
    int recommendedDays;
    @Singular
    List<DayPlan> dayPlans;
    double totalDistanceKm;
    double totalTimeHours;
    /** Input locations present in no day plan. */
    @Singular
    List<VisitLocation> unvisitedLocations;
    @Singular
    List<String> optimizationNotes;
    @Singular
    List<String> alternativeSuggestions;
    /** Whether travel times came from the provider or from straight-line estimation. */
    MatrixSource matrixSource;
}
