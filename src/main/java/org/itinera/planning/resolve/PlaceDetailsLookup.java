package org.itinera.planning.resolve;

import org.itinera.planning.model.GeoPoint;

/**
 * Place-details collaborator.
 */
@FunctionalInterface
public interface PlaceDetailsLookup {
    /**
     * Returns the coordinates of one place reference.
     *
     * @param placeId external place id.
     * @return place coordinates, or {@code null} when the place has none.
     */
    GeoPoint lookup(String placeId);
}
