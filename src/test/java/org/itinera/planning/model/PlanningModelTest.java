package org.itinera.planning.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Planning Model Tests")
class PlanningModelTest {

    @Test
    @DisplayName("Coordinate descriptor parses with surrounding whitespace")
    void testParseDescriptor() {
        GeoPoint point = GeoPoint.parse(" 12.935 , 77.620 ");

        assertEquals(12.935d, point.getLat(), 1e-12);
        assertEquals(77.620d, point.getLng(), 1e-12);
        assertEquals(point, GeoPoint.parse(point.toDescriptor()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "12.9", "12.9,77.6,1", "north,east", "91,0", "0,181", "NaN,0"})
    @DisplayName("Malformed or out-of-range descriptors are rejected")
    void testParseInvalid(String text) {
        assertThrows(IllegalArgumentException.class, () -> GeoPoint.parse(text));
    }

    @Test
    @DisplayName("Coordinate bounds are inclusive")
    void testBounds() {
        assertDoesNotThrow(() -> GeoPoint.of(90.0d, 180.0d));
        assertDoesNotThrow(() -> GeoPoint.of(-90.0d, -180.0d));
        assertThrows(IllegalArgumentException.class, () -> GeoPoint.of(Double.POSITIVE_INFINITY, 0.0d));
    }

    @Test
    @DisplayName("Vehicle speed falls back to mode default")
    void testVehicleSpeed() {
        assertEquals(40.0d, Vehicle.of(VehicleMode.CAR).effectiveSpeedKmh());
        assertEquals(15.0d, Vehicle.of(VehicleMode.BIKE).effectiveSpeedKmh());
        assertEquals(5.0d, Vehicle.of(VehicleMode.WALKING).effectiveSpeedKmh());
        assertEquals(25.0d, Vehicle.of(VehicleMode.PUBLIC_TRANSPORT).effectiveSpeedKmh());

        assertEquals(60.0d, Vehicle.builder().mode(VehicleMode.CAR).averageSpeedKmh(60.0d).build().effectiveSpeedKmh());
        assertEquals(5.0d, Vehicle.builder().mode(VehicleMode.WALKING).averageSpeedKmh(0.0d).build().effectiveSpeedKmh());
        assertEquals(15.0d, Vehicle.builder().mode(VehicleMode.BIKE).averageSpeedKmh(-3.0d).build().effectiveSpeedKmh());
    }

    @Test
    @DisplayName("Vehicle mode codes match the distance provider vocabulary")
    void testModeCodes() {
        assertEquals("driving", Vehicle.of(VehicleMode.CAR).routeModeCode());
        assertEquals("cycling", Vehicle.of(VehicleMode.BIKE).routeModeCode());
        assertEquals("walking", Vehicle.of(VehicleMode.WALKING).routeModeCode());
        assertEquals("transit", Vehicle.of(VehicleMode.PUBLIC_TRANSPORT).routeModeCode());
        assertEquals("driving", Vehicle.builder().build().routeModeCode());
    }

    @Test
    @DisplayName("Missing priority defaults to medium")
    void testPriorityDefault() {
        VisitLocation location = VisitLocation.builder().name("Museum").visitDurationMinutes(60).build();

        assertEquals(Priority.MEDIUM, location.effectivePriority());
        assertTrue(Priority.HIGH.rank() > Priority.MEDIUM.rank());
        assertTrue(Priority.HIGH.travelBonus() < Priority.LOW.travelBonus());
    }

    @Test
    @DisplayName("Resolution returns an enriched copy")
    void testWithCoordinates() {
        VisitLocation original = VisitLocation.builder()
                .name("Museum")
                .address("1 Main St")
                .visitDurationMinutes(60)
                .priority(Priority.HIGH)
                .build();
        GeoPoint point = GeoPoint.of(1.0d, 2.0d);

        VisitLocation resolved = original.withCoordinates(point);

        assertNull(original.getCoordinates());
        assertEquals(point, resolved.getCoordinates());
        assertEquals("1 Main St", resolved.getAddress());
        assertEquals(Priority.HIGH, resolved.getPriority());
    }
}
