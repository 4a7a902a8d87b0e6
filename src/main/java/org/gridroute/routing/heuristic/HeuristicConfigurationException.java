package org.gridroute.routing.heuristic;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a heuristic provider cannot be created for a grid.
 *
 * <p>Reason codes live in the {@code GR_HEURISTIC_} namespace. The requested type is kept so
 * callers can report which provider failed; it is {@code null} when no type was requested.</p>
 */
@Getter
@Accessors(fluent = true)
public final class HeuristicConfigurationException extends RuntimeException {
    static final String REASON_PREFIX = "GR_HEURISTIC_";

    private final String reasonCode;
    private final HeuristicType heuristicType;

    public HeuristicConfigurationException(String reasonCode, HeuristicType heuristicType, String message) {
        super("[" + checkedCode(reasonCode) + "] " + Objects.requireNonNull(message, "message")
                + (heuristicType == null ? "" : " (heuristic " + heuristicType + ")"));
        this.reasonCode = reasonCode;
        this.heuristicType = heuristicType;
    }

    private static String checkedCode(String reasonCode) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (!reasonCode.startsWith(REASON_PREFIX) || reasonCode.length() == REASON_PREFIX.length()) {
            throw new IllegalArgumentException("reason code must start with " + REASON_PREFIX + ", got '" + reasonCode + "'");
        }
        return reasonCode;
    }
}
