package org.itinera.planning.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Supported travel modes.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum VehicleMode {
    CAR("driving", 40.0d),
    BIKE("cycling", 15.0d),
    WALKING("walking", 5.0d),
    PUBLIC_TRANSPORT("transit", 25.0d);

    /** Mode code passed to the distance provider. */
    private final String routeModeCode;
    /** Fallback speed in km/h used by straight-line estimation. */
    private final double defaultSpeedKmh;
}
