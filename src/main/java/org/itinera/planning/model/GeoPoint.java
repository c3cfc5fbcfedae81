package org.itinera.planning.model;

import lombok.Value;

/**
 * Immutable latitude/longitude pair in degrees.
 */
@Value
public class GeoPoint {
    private static final double MIN_LAT = -90.0d;
    private static final double MAX_LAT = 90.0d;
    private static final double MIN_LNG = -180.0d;
    private static final double MAX_LNG = 180.0d;

    double lat;
    double lng;

    private GeoPoint(double lat, double lng) {
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) {
            throw new IllegalArgumentException("coordinates must be finite: " + lat + "," + lng);
        }
        if (lat < MIN_LAT || lat > MAX_LAT) {
            throw new IllegalArgumentException("latitude out of range [-90, 90]: " + lat);
        }
        if (lng < MIN_LNG || lng > MAX_LNG) {
            throw new IllegalArgumentException("longitude out of range [-180, 180]: " + lng);
        }
        this.lat = lat;
        this.lng = lng;
    }

    /**
     * Creates a validated coordinate pair.
     */
    public static GeoPoint of(double lat, double lng) {
        return new GeoPoint(lat, lng);
    }

    /**
     * Parses the {@code "lat,lng"} descriptor form.
     *
     * @param text comma-separated latitude and longitude.
     * @return parsed coordinate pair.
     * @throws IllegalArgumentException when the text is not a valid pair.
     */
    public static GeoPoint parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("coordinate text must be non-blank");
        }
        String[] parts = text.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("coordinate text must be 'lat,lng': " + text);
        }
        try {
            return of(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("coordinate text must be numeric: " + text, ex);
        }
    }

    /**
     * Returns the {@code "lat,lng"} descriptor form.
     */
    public String toDescriptor() {
        return lat + "," + lng;
    }
}
