package org.itinera.planning.resolve;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.itinera.planning.model.VisitLocation;

import java.util.List;

/**
 * Outcome of resolving every location of a request without short-circuiting.
 */
@Value
@Builder
public class ResolutionReport {
    /** Resolved copies, in input order. */
    @Singular
    List<VisitLocation> resolvedLocations;
    /** Original inputs that could not be resolved, in input order. */
    @Singular
    List<VisitLocation> unresolvedLocations;
    /** Failure message per unresolved location, aligned with {@link #unresolvedLocations}. */
    @Singular
    List<String> failureMessages;

    /**
     * True when every location resolved.
     */
    public boolean isComplete() {
        return unresolvedLocations.isEmpty();
    }
}
