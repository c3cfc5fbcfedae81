package org.itinera.planning.matrix;

import java.util.Objects;

/**
 * Square travel matrix in planner units: whole minutes and kilometers.
 *
 * <p>Row/column {@code i} is the {@code i}-th resolved location of the request.</p>
 */
public final class TravelMatrix {
    /** Travel minutes used when the provider reports no route for a pair. */
    public static final int NO_ROUTE_MINUTES = 999_999;

    private final int[][] travelMinutes;
    private final double[][] distanceKm;
    private final MatrixSource source;

    private TravelMatrix(int[][] travelMinutes, double[][] distanceKm, MatrixSource source) {
        this.travelMinutes = travelMinutes;
        this.distanceKm = distanceKm;
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Creates a matrix from square minute and kilometer tables of equal size.
     *
     * @throws IllegalArgumentException when tables are not square or sizes differ.
     */
    public static TravelMatrix of(int[][] travelMinutes, double[][] distanceKm, MatrixSource source) {
        Objects.requireNonNull(travelMinutes, "travelMinutes");
        Objects.requireNonNull(distanceKm, "distanceKm");
        int size = travelMinutes.length;
        if (distanceKm.length != size) {
            throw new IllegalArgumentException("distance table size " + distanceKm.length + " != " + size);
        }
        int[][] minutesCopy = new int[size][];
        double[][] kmCopy = new double[size][];
        for (int i = 0; i < size; i++) {
            if (travelMinutes[i] == null || travelMinutes[i].length != size
                    || distanceKm[i] == null || distanceKm[i].length != size) {
                throw new IllegalArgumentException("row " + i + " is not of length " + size);
            }
            minutesCopy[i] = travelMinutes[i].clone();
            kmCopy[i] = distanceKm[i].clone();
        }
        return new TravelMatrix(minutesCopy, kmCopy, source);
    }

    /**
     * Creates a provider-sourced matrix with minutes only; distances are zero.
     */
    public static TravelMatrix ofMinutes(int[][] travelMinutes) {
        int size = travelMinutes.length;
        return of(travelMinutes, new double[size][size], MatrixSource.PROVIDER);
    }

    /**
     * Number of locations (rows).
     */
    public int size() {
        return travelMinutes.length;
    }

    /**
     * Travel minutes from location {@code from} to location {@code to}.
     */
    public int travelMinutes(int from, int to) {
        return travelMinutes[from][to];
    }

    /**
     * Distance in kilometers from location {@code from} to location {@code to}.
     */
    public double distanceKm(int from, int to) {
        return distanceKm[from][to];
    }

    public MatrixSource source() {
        return source;
    }
}
