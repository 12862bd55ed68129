package fr.lapetina.failover.domain.model;

/**
 * Classification of a single attempt against one origin.
 * Everything except {@link #SUCCESS} makes the router fail over to the next origin.
 */
public enum OutcomeType {
    /** Origin answered with a success status; its response is returned to the caller */
    SUCCESS,

    /** Origin answered, but with a status outside the success set (including other 2xx and 3xx) */
    BAD_STATUS,

    /** No response within the per-attempt timeout; the exchange was cancelled */
    TIMEOUT,

    /** DNS failure, connection refused, reset, or any other transport-level error */
    TRANSPORT_ERROR
}
