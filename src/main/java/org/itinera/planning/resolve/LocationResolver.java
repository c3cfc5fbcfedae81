package org.itinera.planning.resolve;

import org.itinera.planning.TripPlanningException;
import org.itinera.planning.model.GeoPoint;
import org.itinera.planning.model.VisitLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Resolves visit locations to coordinates through injected collaborators.
 *
 * <p>Resolution order per location:</p>
 * <ul>
 * <li>use {@code coordinates} when present;</li>
 * <li>else geocode {@code address} and take the first result;</li>
 * <li>else look up {@code placeId} details.</li>
 * </ul>
 * <p>A collaborator failure at one step is logged and the next step is tried. Batch
 * methods may fan out over a bounded pool; results are always returned in input order.</p>
 */
public final class LocationResolver {
    public static final String REASON_RESOLUTION_INTERRUPTED = "TP_RESOLUTION_INTERRUPTED";
    public static final String REASON_RESOLUTION_FAILED = "TP_RESOLUTION_FAILED";

    private static final Logger log = LoggerFactory.getLogger(LocationResolver.class);

    private final Geocoder geocoder;
    private final PlaceDetailsLookup placeDetailsLookup;
    private final int parallelism;

    /**
     * Creates a resolver.
     *
     * @param geocoder address collaborator; address step is skipped when null.
     * @param placeDetailsLookup place collaborator; place step is skipped when null.
     * @param parallelism max concurrent resolutions for batch calls; values below 2 run sequentially.
     */
    public LocationResolver(Geocoder geocoder, PlaceDetailsLookup placeDetailsLookup, int parallelism) {
        this.geocoder = geocoder;
        this.placeDetailsLookup = placeDetailsLookup;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Resolves one location.
     *
     * @param location location to resolve.
     * @return coordinates of the location.
     * @throws UnresolvableLocationException when no step yields coordinates.
     */
    public GeoPoint resolve(VisitLocation location) {
        Objects.requireNonNull(location, "location");
        if (location.getCoordinates() != null) {
            return location.getCoordinates();
        }

        GeoPoint geocoded = geocode(location.getAddress());
        if (geocoded != null) {
            return geocoded;
        }

        GeoPoint fromPlace = lookupPlace(location.getPlaceId());
        if (fromPlace != null) {
            return fromPlace;
        }

        throw new UnresolvableLocationException(location.getName());
    }

    /**
     * Resolves every location, failing on the first unresolved one in input order.
     *
     * @param locations request locations.
     * @return resolved copies in input order.
     * @throws UnresolvableLocationException for the earliest unresolved location.
     */
    public List<VisitLocation> resolveAll(List<VisitLocation> locations) {
        if (!parallel(locations)) {
            List<VisitLocation> resolved = new ArrayList<>(locations.size());
            for (VisitLocation location : locations) {
                resolved.add(location.withCoordinates(resolve(location)));
            }
            return resolved;
        }

        List<Outcome> outcomes = resolveConcurrently(locations);
        List<VisitLocation> resolved = new ArrayList<>(outcomes.size());
        for (Outcome outcome : outcomes) {
            if (outcome.failure() != null) {
                throw outcome.failure();
            }
            resolved.add(outcome.location().withCoordinates(outcome.point()));
        }
        return resolved;
    }

    /**
     * Attempts every location without short-circuiting.
     *
     * @param locations request locations.
     * @return resolved and unresolved locations, each in input order.
     */
    public ResolutionReport diagnose(List<VisitLocation> locations) {
        List<Outcome> outcomes = parallel(locations)
                ? resolveConcurrently(locations)
                : resolveSequentially(locations);

        ResolutionReport.ResolutionReportBuilder report = ResolutionReport.builder();
        for (Outcome outcome : outcomes) {
            if (outcome.failure() == null) {
                report.resolvedLocation(outcome.location().withCoordinates(outcome.point()));
            } else {
                report.unresolvedLocation(outcome.location());
                report.failureMessage(outcome.failure().getMessage());
            }
        }
        return report.build();
    }

    private boolean parallel(List<VisitLocation> locations) {
        return parallelism > 1 && locations.size() > 1;
    }

    private List<Outcome> resolveSequentially(List<VisitLocation> locations) {
        List<Outcome> outcomes = new ArrayList<>(locations.size());
        for (VisitLocation location : locations) {
            outcomes.add(attempt(location));
        }
        return outcomes;
    }

    /**
     * Fans resolution out over a pool sized for this call and joins in input order.
     */
    private List<Outcome> resolveConcurrently(List<VisitLocation> locations) {
        int poolSize = Math.min(parallelism, locations.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<Outcome>> futures = new ArrayList<>(locations.size());
            for (VisitLocation location : locations) {
                futures.add(executor.submit(() -> attempt(location)));
            }
            List<Outcome> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(join(futures.get(i), locations.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private Outcome join(Future<Outcome> future, VisitLocation location) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TripPlanningException(
                    REASON_RESOLUTION_INTERRUPTED,
                    "interrupted while resolving location " + location.getName(),
                    ex
            );
        } catch (ExecutionException ex) {
            throw new TripPlanningException(
                    REASON_RESOLUTION_FAILED,
                    "resolution task failed for location " + location.getName(),
                    ex.getCause()
            );
        }
    }

    private Outcome attempt(VisitLocation location) {
        try {
            return new Outcome(location, resolve(location), null);
        } catch (UnresolvableLocationException ex) {
            return new Outcome(location, null, ex);
        }
    }

    private GeoPoint geocode(String address) {
        if (geocoder == null || address == null || address.isBlank()) {
            return null;
        }
        try {
            List<GeoPoint> results = geocoder.geocode(address);
            if (results != null && !results.isEmpty() && results.get(0) != null) {
                return results.get(0);
            }
            log.warn("No geocoding result for address: {}", address);
        } catch (RuntimeException ex) {
            log.warn("Failed to geocode address: {}", address, ex);
        }
        return null;
    }

    private GeoPoint lookupPlace(String placeId) {
        if (placeDetailsLookup == null || placeId == null || placeId.isBlank()) {
            return null;
        }
        try {
            GeoPoint point = placeDetailsLookup.lookup(placeId);
            if (point == null) {
                log.warn("Place details carry no coordinates for: {}", placeId);
            }
            return point;
        } catch (RuntimeException ex) {
            log.warn("Failed to get place details for: {}", placeId, ex);
            return null;
        }
    }

    private record Outcome(VisitLocation location, GeoPoint point, UnresolvableLocationException failure) {
    }
}
