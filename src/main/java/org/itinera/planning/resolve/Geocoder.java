package org.itinera.planning.resolve;

import org.itinera.planning.model.GeoPoint;

import java.util.List;

/**
 * Address geocoding collaborator.
 */
@FunctionalInterface
public interface Geocoder {
    /**
     * Geocodes one free-form address.
     *
     * @param address address text.
     * @return candidate coordinates, best match first; empty when nothing matched.
     */
    List<GeoPoint> geocode(String address);
}
