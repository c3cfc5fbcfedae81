package org.itinera.planning.matrix;

import org.itinera.planning.model.GeoPoint;

import java.util.List;

/**
 * Distance-matrix collaborator.
 *
 * <p>Implementations call an external routing service. Retry and timeout policy belong
 * to the implementation; the planner recovers from any failure by estimating.</p>
 */
@FunctionalInterface
public interface DistanceProvider {
    /**
     * Computes all-pairs travel durations and distances.
     *
     * @param coordinates K points; rows and columns follow this order.
     * @param modeCode travel-mode code such as {@code driving} or {@code transit}.
     * @return K×K result.
     * @throws DistanceProviderException when the service is unavailable or rejects the call.
     */
    DistanceMatrixResult fetch(List<GeoPoint> coordinates, String modeCode);
}
