package org.itinera.planning.matrix;

import lombok.Builder;
import lombok.Value;

/**
 * Raw provider matrix in provider units.
 *
 * <p>A negative or non-finite cell means the provider has no value for that pair.
 * Array-valued fields are exposed through defensive-copy getters.</p>
 */
@Value
@Builder
public class DistanceMatrixResult {
    /** Travel durations in seconds. */
    double[][] durationsSeconds;
    /** Travel distances in meters; may be null when the provider reports durations only. */
    double[][] distancesMeters;

    /**
     * Returns a defensive copy of the durations matrix.
     */
    public double[][] getDurationsSeconds() {
        return deepCopy(durationsSeconds);
    }

    /**
     * Returns a defensive copy of the distances matrix, or null.
     */
    public double[][] getDistancesMeters() {
        return deepCopy(distancesMeters);
    }

    private static double[][] deepCopy(double[][] source) {
        if (source == null) {
            return null;
        }
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i] == null ? null : source[i].clone();
        }
        return copy;
    }
}
