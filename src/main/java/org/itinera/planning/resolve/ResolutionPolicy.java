package org.itinera.planning.resolve;

/**
 * How the planner reacts to locations that cannot be resolved.
 *
 * <p>{@code STRICT} aborts planning on the first unresolved location (input order).
 * {@code LENIENT} plans the resolved locations and reports the rest as unvisited.</p>
 */
public enum ResolutionPolicy {
    STRICT,
    LENIENT
}
