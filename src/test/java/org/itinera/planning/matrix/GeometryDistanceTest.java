package org.itinera.planning.matrix;

import org.itinera.planning.model.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("GeometryDistance Tests")
class GeometryDistanceTest {

    @Test
    @DisplayName("One degree of longitude at the equator is about 111.19 km")
    void testEquatorDegree() {
        double km = GeometryDistance.greatCircleDistanceKm(GeoPoint.of(0.0d, 0.0d), GeoPoint.of(0.0d, 1.0d));
        assertEquals(111.19d, km, 0.01d);
    }

    @Test
    @DisplayName("Distance is symmetric and zero for identical points")
    void testSymmetry() {
        GeoPoint a = GeoPoint.of(12.931d, 77.616d);
        GeoPoint b = GeoPoint.of(12.940d, 77.625d);

        assertEquals(
                GeometryDistance.greatCircleDistanceKm(a, b),
                GeometryDistance.greatCircleDistanceKm(b, a),
                1e-12
        );
        assertEquals(0.0d, GeometryDistance.greatCircleDistanceKm(a, a), 1e-12);
    }

    @Test
    @DisplayName("Antimeridian crossing takes the short way round")
    void testAntimeridian() {
        double km = GeometryDistance.greatCircleDistanceKm(GeoPoint.of(0.0d, 179.5d), GeoPoint.of(0.0d, -179.5d));
        assertEquals(111.19d, km, 0.01d);
        assertEquals(180.0d, GeometryDistance.normalizeDeltaLongitudeDegrees(-180.0d));
        assertEquals(-1.0d, GeometryDistance.normalizeDeltaLongitudeDegrees(359.0d), 1e-12);
    }

    @Test
    @DisplayName("Travel minutes round up")
    void testTravelMinutes() {
        assertEquals(167, GeometryDistance.travelMinutes(111.19d, 40.0d));
        assertEquals(60, GeometryDistance.travelMinutes(40.0d, 40.0d));
        assertEquals(0, GeometryDistance.travelMinutes(0.0d, 40.0d));
    }
}
