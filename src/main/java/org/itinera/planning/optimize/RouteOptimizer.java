package org.itinera.planning.optimize;

import org.itinera.planning.matrix.TravelMatrix;
import org.itinera.planning.model.TripConstraints;
import org.itinera.planning.model.VisitLocation;

import java.util.List;

/**
 * Visit-order strategy.
 *
 * <p>Implementations must be deterministic for identical inputs and must return every
 * input index exactly once.</p>
 */
public interface RouteOptimizer {
    /**
     * Orders locations for visiting.
     *
     * @param locations resolved locations; index {@code i} is matrix row {@code i}.
     * @param matrix travel matrix aligned with {@code locations}.
     * @param constraints trip constraints.
     * @return permutation of {@code [0, locations.size())} in visit order.
     */
    int[] order(List<VisitLocation> locations, TravelMatrix matrix, TripConstraints constraints);
}
