package org.itinera.planning.matrix;

import org.itinera.planning.TripPlanningException;

/**
 * Failure raised by a {@link DistanceProvider}.
 *
 * <p>Never reaches planner callers: {@link TravelMatrixService} falls back to estimation.</p>
 */
public final class DistanceProviderException extends TripPlanningException {
    public static final String REASON_PROVIDER_UNAVAILABLE = "TP_DISTANCE_PROVIDER_UNAVAILABLE";

    public DistanceProviderException(String message) {
        super(REASON_PROVIDER_UNAVAILABLE, message);
    }

    public DistanceProviderException(String message, Throwable cause) {
        super(REASON_PROVIDER_UNAVAILABLE, message, cause);
    }
}
