package org.itinera.planning;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.Builder;
import org.itinera.core.id.IDMapper;
import org.itinera.core.time.TimeUtils;
import org.itinera.planning.aggregate.TripPlanAggregator;
import org.itinera.planning.matrix.DistanceProvider;
import org.itinera.planning.matrix.TravelMatrix;
import org.itinera.planning.matrix.TravelMatrixService;
import org.itinera.planning.model.DayPlan;
import org.itinera.planning.model.ScheduledStop;
import org.itinera.planning.model.TripConstraints;
import org.itinera.planning.model.TripPlan;
import org.itinera.planning.model.Vehicle;
import org.itinera.planning.model.VisitLocation;
import org.itinera.planning.optimize.PriorityNearestNeighborOptimizer;
import org.itinera.planning.optimize.RouteOptimizer;
import org.itinera.planning.resolve.Geocoder;
import org.itinera.planning.resolve.LocationResolver;
import org.itinera.planning.resolve.PlaceDetailsLookup;
import org.itinera.planning.resolve.ResolutionPolicy;
import org.itinera.planning.resolve.ResolutionReport;
import org.itinera.planning.schedule.ScheduleBuilder;
import org.itinera.planning.split.DayPlanSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Main trip planning entry point.
 *
 * <p>Collaborators are injected at construction; the planner keeps no per-request state,
 * so one instance can serve concurrent requests. Execution flow:</p>
 * <ul>
 * <li>Validate request payload and constraints.</li>
 * <li>Resolve locations to coordinates (strict or lenient policy).</li>
 * <li>Build the travel matrix, falling back to straight-line estimation.</li>
 * <li>Order visits with the configured {@link RouteOptimizer} and check the order is a permutation.</li>
 * <li>Build the linear schedule and split it into day plans.</li>
 * <li>Aggregate totals and advisory notes.</li>
 * </ul>
 */
public final class TripPlanner implements PlannerService {
    public static final String REASON_REQUEST_REQUIRED = "TP_REQUEST_REQUIRED";
    public static final String REASON_LOCATIONS_REQUIRED = "TP_LOCATIONS_REQUIRED";
    public static final String REASON_LOCATION_INVALID = "TP_LOCATION_INVALID";
    public static final String REASON_DUPLICATE_LOCATION_NAME = "TP_DUPLICATE_LOCATION_NAME";
    public static final String REASON_VEHICLE_REQUIRED = "TP_VEHICLE_REQUIRED";
    public static final String REASON_CONSTRAINTS_REQUIRED = "TP_CONSTRAINTS_REQUIRED";
    public static final String REASON_INVALID_TIME = "TP_INVALID_TIME";
    public static final String REASON_WINDOW_NOT_POSITIVE = "TP_WINDOW_NOT_POSITIVE";
    public static final String REASON_INVALID_DATE = "TP_INVALID_DATE";
    public static final String REASON_INVALID_VISIT_ORDER = "TP_INVALID_VISIT_ORDER";

    /** Longest accepted single visit. */
    static final int MAX_VISIT_DURATION_MINUTES = TimeUtils.MINUTES_PER_DAY;

    private static final Logger log = LoggerFactory.getLogger(TripPlanner.class);

    private final LocationResolver locationResolver;
    private final TravelMatrixService travelMatrixService;
    private final RouteOptimizer routeOptimizer;
    private final ScheduleBuilder scheduleBuilder;
    private final DayPlanSplitter dayPlanSplitter;
    private final TripPlanAggregator tripPlanAggregator;
    private final ResolutionPolicy resolutionPolicy;

    /**
     * Creates the planner.
     *
     * @param geocoder address collaborator (optional).
     * @param placeDetailsLookup place collaborator (optional).
     * @param distanceProvider distance-matrix collaborator (optional; estimation when absent).
     * @param routeOptimizer optional optimizer override.
     * @param config optional runtime config; {@link PlannerRuntimeConfig#defaults()} when null.
     */
    @Builder
    public TripPlanner(
            Geocoder geocoder,
            PlaceDetailsLookup placeDetailsLookup,
            DistanceProvider distanceProvider,
            RouteOptimizer routeOptimizer,
            PlannerRuntimeConfig config
    ) {
        PlannerRuntimeConfig runtimeConfig = config == null ? PlannerRuntimeConfig.defaults() : config;
        this.locationResolver = new LocationResolver(
                geocoder,
                placeDetailsLookup,
                runtimeConfig.getResolverParallelism()
        );
        this.travelMatrixService = new TravelMatrixService(distanceProvider);
        this.routeOptimizer = routeOptimizer == null ? new PriorityNearestNeighborOptimizer() : routeOptimizer;
        this.scheduleBuilder = new ScheduleBuilder();
        this.dayPlanSplitter = new DayPlanSplitter();
        this.tripPlanAggregator = new TripPlanAggregator(runtimeConfig.getTravelAdvisoryThresholdMinutes());
        this.resolutionPolicy = runtimeConfig.getResolutionPolicy();
    }

    /**
     * Plans one trip.
     *
     * @param request planning request.
     * @return trip plan; schedule overflow is reported through infeasible day plans.
     * @throws TripPlanningException when the request is invalid.
     * @throws InvalidConstraintsException when the daily window is unusable.
     * @throws org.itinera.planning.resolve.UnresolvableLocationException when a location
     *         cannot be resolved under the strict policy.
     */
    @Override
    public TripPlan plan(TripPlanRequest request) {
        validate(request);
        List<VisitLocation> requested = request.getLocations();
        TripConstraints constraints = request.getConstraints();

        List<VisitLocation> resolved = resolve(requested);
        if (resolved.isEmpty()) {
            log.warn("No location of {} could be resolved; returning empty plan", requested.size());
            return tripPlanAggregator.aggregate(List.of(), requested, constraints, null);
        }

        TravelMatrix matrix = travelMatrixService.build(resolved, request.getVehicle());
        int[] visitOrder = requireVisitOrder(
                routeOptimizer.order(resolved, matrix, constraints),
                IDMapper.fromOrderedNames(namesOf(resolved))
        );
        List<ScheduledStop> schedule = scheduleBuilder.build(resolved, visitOrder, matrix, constraints);
        List<DayPlan> dayPlans = dayPlanSplitter.split(schedule, constraints, request.getDate());
        log.debug("Planned {} locations into {} days using {} travel times",
                resolved.size(), dayPlans.size(), matrix.source());

        return tripPlanAggregator.aggregate(dayPlans, requested, constraints, matrix.source());
    }

    /**
     * Resolves every location of the request without planning.
     *
     * <p>Attempts all locations so callers can report every problem at once.</p>
     */
    public ResolutionReport diagnose(List<VisitLocation> locations) {
        return locationResolver.diagnose(locations == null ? List.of() : locations);
    }

    private List<VisitLocation> resolve(List<VisitLocation> requested) {
        if (resolutionPolicy == ResolutionPolicy.STRICT) {
            return locationResolver.resolveAll(requested);
        }
        ResolutionReport report = locationResolver.diagnose(requested);
        if (!report.isComplete()) {
            log.warn("Planning without {} unresolved locations: {}",
                    report.getUnresolvedLocations().size(), report.getFailureMessages());
        }
        return new ArrayList<>(report.getResolvedLocations());
    }

    /**
     * Rejects optimizer output that drops, repeats or invents a location index.
     */
    private static int[] requireVisitOrder(int[] visitOrder, IDMapper locationIds) {
        int size = locationIds.size();
        if (visitOrder == null || visitOrder.length != size) {
            throw new TripPlanningException(
                    REASON_INVALID_VISIT_ORDER,
                    "visit order must list all " + size + " locations, got "
                            + (visitOrder == null ? "null" : visitOrder.length + " entries")
            );
        }
        IntOpenHashSet seen = new IntOpenHashSet(size);
        for (int index : visitOrder) {
            if (index < 0 || index >= size) {
                throw new TripPlanningException(
                        REASON_INVALID_VISIT_ORDER,
                        "visit order index out of range [0, " + size + "): " + index
                );
            }
            if (!seen.add(index)) {
                throw new TripPlanningException(
                        REASON_INVALID_VISIT_ORDER,
                        "visit order repeats location " + locationIds.toExternal(index)
                );
            }
        }
        return visitOrder;
    }

    private static List<String> namesOf(List<VisitLocation> locations) {
        List<String> names = new ArrayList<>(locations.size());
        for (VisitLocation location : locations) {
            names.add(location.getName());
        }
        return names;
    }

    /**
     * Enforces request invariants before any collaborator is called.
     */
    private void validate(TripPlanRequest request) {
        if (request == null) {
            throw new TripPlanningException(REASON_REQUEST_REQUIRED, "trip plan request must be provided");
        }
        List<VisitLocation> locations = request.getLocations();
        if (locations == null || locations.isEmpty()) {
            throw new TripPlanningException(REASON_LOCATIONS_REQUIRED, "at least one location must be provided");
        }
        List<String> names = new ArrayList<>(locations.size());
        for (int i = 0; i < locations.size(); i++) {
            names.add(validateLocation(locations.get(i), i));
        }
        try {
            IDMapper.fromOrderedNames(names);
        } catch (IDMapper.DuplicateIDException ex) {
            throw new TripPlanningException(REASON_DUPLICATE_LOCATION_NAME, "location names must be unique", ex);
        }

        Vehicle vehicle = request.getVehicle();
        if (vehicle == null) {
            throw new TripPlanningException(REASON_VEHICLE_REQUIRED, "vehicle must be provided");
        }
        validateConstraints(request.getConstraints());
        validateDate(request.getDate());
    }

    private static String validateLocation(VisitLocation location, int index) {
        if (location == null) {
            throw new TripPlanningException(REASON_LOCATION_INVALID, "locations[" + index + "] must be non-null");
        }
        String name = location.getName();
        if (name == null || name.isBlank()) {
            throw new TripPlanningException(REASON_LOCATION_INVALID, "locations[" + index + "].name must be non-blank");
        }
        int visitMinutes = location.getVisitDurationMinutes();
        if (visitMinutes <= 0 || visitMinutes > MAX_VISIT_DURATION_MINUTES) {
            throw new TripPlanningException(
                    REASON_LOCATION_INVALID,
                    "visit duration must be in [1, " + MAX_VISIT_DURATION_MINUTES + "] for location "
                            + name + ": " + visitMinutes
            );
        }
        return name;
    }

    private static void validateConstraints(TripConstraints constraints) {
        if (constraints == null) {
            throw new InvalidConstraintsException(REASON_CONSTRAINTS_REQUIRED, "trip constraints must be provided");
        }
        int start = parseClock(constraints.getStartTime(), "startTime");
        int end = parseClock(constraints.getEndTime(), "endTime");
        if (end <= start) {
            throw new InvalidConstraintsException(
                    REASON_WINDOW_NOT_POSITIVE,
                    "endTime " + constraints.getEndTime() + " must be later than startTime " + constraints.getStartTime()
            );
        }
    }

    private static int parseClock(String clock, String fieldName) {
        try {
            return TimeUtils.parseClockMinutes(clock);
        } catch (IllegalArgumentException ex) {
            throw new InvalidConstraintsException(REASON_INVALID_TIME, fieldName + " must be HH:MM, got " + clock, ex);
        }
    }

    private static void validateDate(String date) {
        if (date == null) {
            return;
        }
        try {
            LocalDate.parse(date.trim());
        } catch (DateTimeParseException ex) {
            throw new TripPlanningException(REASON_INVALID_DATE, "date must be ISO yyyy-MM-dd, got " + date, ex);
        }
    }
}
