package org.itinera.planning.model;

import lombok.Builder;
import lombok.Value;

/**
 * Vehicle profile for one trip.
 *
 * <p>Only {@code mode} and {@code averageSpeedKmh} influence planning; the remaining
 * fields are carried for callers.</p>
 */
@Value
@Builder
public class Vehicle {
    VehicleMode mode;
    /** Average speed in km/h; mode default applies when null or not positive. */
    Double averageSpeedKmh;
    Double fuelEfficiency;
    Integer capacity;

    /**
     * Returns convenience profile for one mode with default speed.
     */
    public static Vehicle of(VehicleMode mode) {
        return Vehicle.builder().mode(mode).build();
    }

    /**
     * Speed used for straight-line travel estimation.
     */
    public double effectiveSpeedKmh() {
        if (averageSpeedKmh != null && averageSpeedKmh > 0.0d && Double.isFinite(averageSpeedKmh)) {
            return averageSpeedKmh;
        }
        return modeOrDefault().defaultSpeedKmh();
    }

    /**
     * Mode code passed to the distance provider.
     */
    public String routeModeCode() {
        return modeOrDefault().routeModeCode();
    }

    private VehicleMode modeOrDefault() {
        return mode == null ? VehicleMode.CAR : mode;
    }
}
