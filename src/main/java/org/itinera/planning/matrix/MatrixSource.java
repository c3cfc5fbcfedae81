package org.itinera.planning.matrix;

/**
 * Origin of a travel matrix.
 */
public enum MatrixSource {
    /** Durations and distances reported by the distance provider. */
    PROVIDER,
    /** Straight-line estimation at vehicle speed. */
    ESTIMATED
}
