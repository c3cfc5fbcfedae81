package org.itinera.planning.matrix;

import org.itinera.planning.model.GeoPoint;
import org.itinera.planning.model.Priority;
import org.itinera.planning.model.Vehicle;
import org.itinera.planning.model.VehicleMode;
import org.itinera.planning.model.VisitLocation;
import org.itinera.planning.testutil.PlanningFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TravelMatrixService Tests")
class TravelMatrixServiceTest {

    private static final List<VisitLocation> EQUATOR = List.of(
            PlanningFixtures.at("West", 0.0d, 0.0d, 30, Priority.MEDIUM),
            PlanningFixtures.at("East", 0.0d, 1.0d, 30, Priority.MEDIUM)
    );

    @Test
    @DisplayName("Provider seconds round up to minutes and meters become kilometers")
    void testProviderConversion() {
        TravelMatrixService service = new TravelMatrixService((points, mode) -> DistanceMatrixResult.builder()
                .durationsSeconds(new double[][]{{0, 601}, {59, 0}})
                .distancesMeters(new double[][]{{0, 2_500}, {2_400, 0}})
                .build());

        TravelMatrix matrix = service.build(EQUATOR, Vehicle.of(VehicleMode.CAR));

        assertEquals(MatrixSource.PROVIDER, matrix.source());
        assertEquals(11, matrix.travelMinutes(0, 1));
        assertEquals(1, matrix.travelMinutes(1, 0));
        assertEquals(0, matrix.travelMinutes(0, 0));
        assertEquals(2.5d, matrix.distanceKm(0, 1), 1e-12);
        assertEquals(2.4d, matrix.distanceKm(1, 0), 1e-12);
    }

    @Test
    @DisplayName("Provider receives coordinates in request order and the vehicle mode code")
    void testProviderArguments() {
        PlanningFixtures.RecordingDistanceProvider provider = new PlanningFixtures.RecordingDistanceProvider(
                new double[][]{{0, 60}, {60, 0}},
                null
        );
        AtomicReference<List<GeoPoint>> seen = new AtomicReference<>();
        TravelMatrixService service = new TravelMatrixService((points, mode) -> {
            seen.set(points);
            return provider.fetch(points, mode);
        });

        service.build(EQUATOR, Vehicle.of(VehicleMode.PUBLIC_TRANSPORT));

        assertEquals(1, provider.calls());
        assertEquals(List.of("transit"), provider.modeCodes());
        assertEquals(List.of(GeoPoint.of(0.0d, 0.0d), GeoPoint.of(0.0d, 1.0d)), seen.get());
    }

    @Test
    @DisplayName("Missing provider durations map to the no-route sentinel; missing distances are estimated")
    void testMissingCells() {
        TravelMatrixService service = new TravelMatrixService((points, mode) -> DistanceMatrixResult.builder()
                .durationsSeconds(new double[][]{{0, Double.NaN}, {-1, 0}})
                .build());

        TravelMatrix matrix = service.build(EQUATOR, Vehicle.of(VehicleMode.CAR));

        assertEquals(MatrixSource.PROVIDER, matrix.source());
        assertEquals(TravelMatrix.NO_ROUTE_MINUTES, matrix.travelMinutes(0, 1));
        assertEquals(TravelMatrix.NO_ROUTE_MINUTES, matrix.travelMinutes(1, 0));
        assertEquals(111.19d, matrix.distanceKm(0, 1), 0.01d);
    }

    @Test
    @DisplayName("Provider failure, null result or wrong shape falls back to estimation")
    void testFallback() {
        List<DistanceProvider> broken = List.of(
                (points, mode) -> {
                    throw new IllegalStateException("quota exceeded");
                },
                (points, mode) -> null,
                (points, mode) -> DistanceMatrixResult.builder()
                        .durationsSeconds(new double[][]{{0}})
                        .build(),
                (points, mode) -> DistanceMatrixResult.builder()
                        .durationsSeconds(new double[][]{{0, 60}, {60, 0}})
                        .distancesMeters(new double[][]{{0, 1}, {1}})
                        .build()
        );

        for (DistanceProvider provider : broken) {
            TravelMatrix matrix = new TravelMatrixService(provider).build(EQUATOR, Vehicle.of(VehicleMode.CAR));
            assertEquals(MatrixSource.ESTIMATED, matrix.source());
            assertEquals(167, matrix.travelMinutes(0, 1));
        }
    }

    @Test
    @DisplayName("Estimation uses haversine distance over vehicle speed")
    void testEstimate() {
        TravelMatrix car = new TravelMatrixService(null).build(EQUATOR, Vehicle.of(VehicleMode.CAR));
        TravelMatrix walking = new TravelMatrixService(null).build(EQUATOR, Vehicle.of(VehicleMode.WALKING));
        TravelMatrix fast = new TravelMatrixService(null).build(
                EQUATOR,
                Vehicle.builder().mode(VehicleMode.CAR).averageSpeedKmh(111.19d).build()
        );

        assertEquals(MatrixSource.ESTIMATED, car.source());
        assertEquals(167, car.travelMinutes(0, 1));
        assertEquals(167, car.travelMinutes(1, 0));
        assertEquals(1335, walking.travelMinutes(0, 1));
        assertEquals(61, fast.travelMinutes(0, 1));
        assertEquals(0, car.travelMinutes(1, 1));
        assertEquals(0.0d, car.distanceKm(0, 0));
    }

    @Test
    @DisplayName("Unresolved location is rejected")
    void testUnresolvedLocation() {
        VisitLocation unresolved = VisitLocation.builder().name("Nowhere").visitDurationMinutes(10).build();

        assertThrows(NullPointerException.class,
                () -> new TravelMatrixService(null).build(List.of(unresolved), Vehicle.of(VehicleMode.CAR)));
    }

    @Test
    @DisplayName("Matrix factory rejects non-square tables and copies input")
    void testMatrixFactory() {
        assertThrows(IllegalArgumentException.class, () -> TravelMatrix.ofMinutes(new int[][]{{0, 1}}));

        int[][] minutes = {{0, 5}, {7, 0}};
        TravelMatrix matrix = TravelMatrix.ofMinutes(minutes);
        minutes[0][1] = 99;

        assertEquals(5, matrix.travelMinutes(0, 1));
        assertEquals(2, matrix.size());
    }
}
