package org.itinera.planning.optimize;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.itinera.planning.matrix.TravelMatrix;
import org.itinera.planning.model.TripConstraints;
import org.itinera.planning.model.VisitLocation;

import java.util.List;

/**
 * Priority-weighted nearest-neighbor ordering.
 *
 * <p>Candidates are first stable-sorted by descending priority rank; the first one seeds
 * the route. Each next stop minimizes {@code travel(current, candidate) * travelBonus},
 * with ties resolved by sorted-list position. Greedy O(n²), no improvement pass.</p>
 */
public final class PriorityNearestNeighborOptimizer implements RouteOptimizer {

    @Override
    public int[] order(List<VisitLocation> locations, TravelMatrix matrix, TripConstraints constraints) {
        int size = locations.size();
        if (matrix.size() != size) {
            throw new IllegalArgumentException("matrix size " + matrix.size() + " != location count " + size);
        }
        if (size == 0) {
            return new int[0];
        }

        IntArrayList unvisited = prioritySorted(locations);
        IntArrayList route = new IntArrayList(size);
        route.add(unvisited.removeInt(0));

        while (!unvisited.isEmpty()) {
            int current = route.getInt(route.size() - 1);
            int nearestPosition = 0;
            double shortest = Double.POSITIVE_INFINITY;
            for (int position = 0; position < unvisited.size(); position++) {
                int candidate = unvisited.getInt(position);
                double effective = matrix.travelMinutes(current, candidate)
                        * locations.get(candidate).effectivePriority().travelBonus();
                if (effective < shortest) {
                    shortest = effective;
                    nearestPosition = position;
                }
            }
            route.add(unvisited.removeInt(nearestPosition));
        }
        return route.toIntArray();
    }

    /**
     * Input indices stable-sorted by descending priority rank.
     */
    private static IntArrayList prioritySorted(List<VisitLocation> locations) {
        int[] indices = new int[locations.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        // merge sort is stable: equal ranks keep input order
        IntArrays.mergeSort(indices, (int a, int b) -> Integer.compare(
                locations.get(b).effectivePriority().rank(),
                locations.get(a).effectivePriority().rank()
        ));
        return IntArrayList.wrap(indices);
    }
}
