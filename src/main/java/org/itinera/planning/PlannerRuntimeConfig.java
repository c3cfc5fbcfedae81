package org.itinera.planning;

import lombok.Builder;
import lombok.Value;
import org.itinera.planning.resolve.ResolutionPolicy;

import java.util.Locale;

/**
 * Runtime configuration bound once when a {@link TripPlanner} is built.
 *
 * <p>Non-positive numbers and a missing policy normalize to defaults on every
 * construction path, so an unset builder field means "use the default".</p>
 */
@Value
public class PlannerRuntimeConfig {
    static final String PROP_RESOLVER_PARALLELISM = "itinera.planner.resolverParallelism";
    static final String PROP_RESOLUTION_POLICY = "itinera.planner.resolutionPolicy";
    static final String PROP_TRAVEL_ADVISORY_THRESHOLD = "itinera.planner.travelAdvisoryThresholdMinutes";

    static final int DEFAULT_RESOLVER_PARALLELISM = 1;
    static final int DEFAULT_TRAVEL_ADVISORY_THRESHOLD_MINUTES = 180;

    /**
     * Max concurrent location resolutions per request; {@code 1} resolves sequentially.
     */
    int resolverParallelism;

    /**
     * Reaction to unresolvable locations.
     */
    ResolutionPolicy resolutionPolicy;

    /**
     * Average daily travel, in minutes, above which geographic regrouping is suggested.
     */
    int travelAdvisoryThresholdMinutes;

    @Builder
    private PlannerRuntimeConfig(
            int resolverParallelism,
            ResolutionPolicy resolutionPolicy,
            int travelAdvisoryThresholdMinutes
    ) {
        this.resolverParallelism = positiveOrDefault(resolverParallelism, DEFAULT_RESOLVER_PARALLELISM);
        this.resolutionPolicy = resolutionPolicy == null ? ResolutionPolicy.STRICT : resolutionPolicy;
        this.travelAdvisoryThresholdMinutes = positiveOrDefault(
                travelAdvisoryThresholdMinutes,
                DEFAULT_TRAVEL_ADVISORY_THRESHOLD_MINUTES
        );
    }

    /**
     * Loads configuration from system properties; missing or invalid values use defaults.
     */
    public static PlannerRuntimeConfig defaults() {
        return PlannerRuntimeConfig.builder()
                .resolverParallelism(readPositiveInt(PROP_RESOLVER_PARALLELISM, DEFAULT_RESOLVER_PARALLELISM))
                .resolutionPolicy(readPolicy(PROP_RESOLUTION_POLICY))
                .travelAdvisoryThresholdMinutes(readPositiveInt(
                        PROP_TRAVEL_ADVISORY_THRESHOLD,
                        DEFAULT_TRAVEL_ADVISORY_THRESHOLD_MINUTES
                ))
                .build();
    }

    private static int readPositiveInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return positiveOrDefault(Integer.parseInt(raw.trim()), fallback);
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static int positiveOrDefault(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    private static ResolutionPolicy readPolicy(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return ResolutionPolicy.STRICT;
        }
        try {
            return ResolutionPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return ResolutionPolicy.STRICT;
        }
    }
}
