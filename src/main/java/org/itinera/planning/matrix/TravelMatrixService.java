package org.itinera.planning.matrix;

import org.itinera.planning.model.GeoPoint;
import org.itinera.planning.model.Vehicle;
import org.itinera.planning.model.VisitLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the travel matrix for resolved locations.
 *
 * <p>The distance provider is called once per request. Any provider failure (exception,
 * missing provider, malformed shape) falls back to haversine estimation at the vehicle
 * speed. This method never throws for provider reasons.</p>
 */
public final class TravelMatrixService {
    private static final Logger log = LoggerFactory.getLogger(TravelMatrixService.class);

    private static final double SECONDS_PER_MINUTE = 60.0d;
    private static final double METERS_PER_KM = 1_000.0d;

    private final DistanceProvider distanceProvider;

    /**
     * @param distanceProvider provider collaborator; estimation is always used when null.
     */
    public TravelMatrixService(DistanceProvider distanceProvider) {
        this.distanceProvider = distanceProvider;
    }

    /**
     * Builds the matrix for locations that all carry coordinates.
     *
     * @param locations resolved locations, in request order.
     * @param vehicle vehicle profile selecting mode code and fallback speed.
     * @return travel matrix aligned with {@code locations}.
     */
    public TravelMatrix build(List<VisitLocation> locations, Vehicle vehicle) {
        Objects.requireNonNull(vehicle, "vehicle");
        List<GeoPoint> points = coordinatesOf(locations);
        if (distanceProvider == null) {
            return estimate(points, vehicle);
        }

        String modeCode = vehicle.routeModeCode();
        try {
            DistanceMatrixResult result = distanceProvider.fetch(List.copyOf(points), modeCode);
            return fromProvider(result, points);
        } catch (RuntimeException ex) {
            log.warn("Distance provider failed for {} locations in mode {}; estimating from straight-line distance",
                    points.size(), modeCode, ex);
            return estimate(points, vehicle);
        }
    }

    /**
     * Straight-line estimate: haversine kilometers over vehicle speed, rounded up to minutes.
     */
    public static TravelMatrix estimate(List<GeoPoint> points, Vehicle vehicle) {
        int size = points.size();
        double speedKmh = vehicle.effectiveSpeedKmh();
        int[][] minutes = new int[size][size];
        double[][] km = new double[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (i == j) {
                    continue;
                }
                double distance = GeometryDistance.greatCircleDistanceKm(points.get(i), points.get(j));
                km[i][j] = distance;
                minutes[i][j] = GeometryDistance.travelMinutes(distance, speedKmh);
            }
        }
        return TravelMatrix.of(minutes, km, MatrixSource.ESTIMATED);
    }

    /**
     * Converts provider units to planner units.
     *
     * <p>Seconds are rounded up to whole minutes. Missing durations become
     * {@link TravelMatrix#NO_ROUTE_MINUTES}; missing distances are estimated.</p>
     */
    private static TravelMatrix fromProvider(DistanceMatrixResult result, List<GeoPoint> points) {
        int size = points.size();
        if (result == null) {
            throw new DistanceProviderException("provider returned no matrix");
        }
        double[][] durations = result.getDurationsSeconds();
        double[][] distances = result.getDistancesMeters();
        requireShape(durations, size, "durations");
        if (distances != null) {
            requireShape(distances, size, "distances");
        }

        int[][] minutes = new int[size][size];
        double[][] km = new double[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (i == j) {
                    continue;
                }
                double seconds = durations[i][j];
                minutes[i][j] = isPresent(seconds)
                        ? (int) Math.ceil(seconds / SECONDS_PER_MINUTE)
                        : TravelMatrix.NO_ROUTE_MINUTES;
                double meters = distances == null ? Double.NaN : distances[i][j];
                km[i][j] = isPresent(meters)
                        ? meters / METERS_PER_KM
                        : GeometryDistance.greatCircleDistanceKm(points.get(i), points.get(j));
            }
        }
        return TravelMatrix.of(minutes, km, MatrixSource.PROVIDER);
    }

    private static void requireShape(double[][] table, int size, String name) {
        if (table == null || table.length != size) {
            throw new DistanceProviderException(name + " matrix must have " + size + " rows");
        }
        for (int i = 0; i < size; i++) {
            if (table[i] == null || table[i].length != size) {
                throw new DistanceProviderException(name + " row " + i + " must have " + size + " columns");
            }
        }
    }

    private static boolean isPresent(double value) {
        return Double.isFinite(value) && value >= 0.0d;
    }

    private static List<GeoPoint> coordinatesOf(List<VisitLocation> locations) {
        List<GeoPoint> points = new ArrayList<>(locations.size());
        for (VisitLocation location : locations) {
            points.add(Objects.requireNonNull(
                    location.getCoordinates(),
                    "location must be resolved before matrix build: " + location.getName()
            ));
        }
        return points;
    }
}
