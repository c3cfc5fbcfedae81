package org.itinera.planning;

/**
 * Thrown when trip constraints cannot describe a usable daily window.
 */
public final class InvalidConstraintsException extends TripPlanningException {

    public InvalidConstraintsException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public InvalidConstraintsException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
