package fr.lapetina.failover.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one bounded-time attempt against a single origin.
 * Immutable; only used to drive the failover loop and observability.
 *
 * @param origin     origin the attempt was made against
 * @param type       outcome classification
 * @param response   the origin's response, only set for {@link OutcomeType#SUCCESS}
 * @param statusCode upstream status for SUCCESS and BAD_STATUS, otherwise 0
 * @param cause      failure cause for TRANSPORT_ERROR (and TIMEOUT when known), otherwise null
 * @param elapsed    wall-clock time spent on the attempt
 */
public record AttemptOutcome(
        Origin origin,
        OutcomeType type,
        ProxyResponse response,
        int statusCode,
        Throwable cause,
        Duration elapsed
) {
    public AttemptOutcome {
        Objects.requireNonNull(origin, "Origin is required");
        Objects.requireNonNull(type, "Outcome type is required");
        if (type == OutcomeType.SUCCESS) {
            Objects.requireNonNull(response, "Successful outcome requires a response");
        }
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    public static AttemptOutcome success(Origin origin, ProxyResponse response, Duration elapsed) {
        return new AttemptOutcome(origin, OutcomeType.SUCCESS, response, response.statusCode(), null, elapsed);
    }

    public static AttemptOutcome badStatus(Origin origin, int statusCode, Duration elapsed) {
        return new AttemptOutcome(origin, OutcomeType.BAD_STATUS, null, statusCode, null, elapsed);
    }

    public static AttemptOutcome timeout(Origin origin, Duration elapsed) {
        return new AttemptOutcome(origin, OutcomeType.TIMEOUT, null, 0, null, elapsed);
    }

    public static AttemptOutcome transportError(Origin origin, Throwable cause, Duration elapsed) {
        return new AttemptOutcome(origin, OutcomeType.TRANSPORT_ERROR, null, 0, cause, elapsed);
    }

    public boolean isSuccess() {
        return type == OutcomeType.SUCCESS;
    }

    /**
     * Short human-readable reason, used in logs.
     */
    public String reason() {
        return switch (type) {
            case SUCCESS -> "status " + statusCode;
            case BAD_STATUS -> "bad status " + statusCode;
            case TIMEOUT -> "timeout";
            case TRANSPORT_ERROR -> cause == null
                    ? "transport error"
                    : "transport error: " + cause.getClass().getSimpleName()
                            + (cause.getMessage() != null ? " (" + cause.getMessage() + ")" : "");
        };
    }
}
