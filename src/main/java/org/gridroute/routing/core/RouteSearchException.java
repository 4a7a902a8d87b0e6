package org.gridroute.routing.core;

import lombok.Getter;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Grid route-search failure carrying a {@code GR_*} reason code.
 *
 * <p>Raised for rejected input, breached search budgets and internal consistency
 * failures. An unreachable goal is a normal outcome and never raises this exception.
 * Messages read {@code [GR_CODE] detail}.</p>
 */
@Getter
public final class RouteSearchException extends RuntimeException {
    private static final Pattern REASON_CODE = Pattern.compile("GR_[A-Z0-9]+(?:_[A-Z0-9]+)*");

    // failures of the engine itself, as opposed to a request it refused
    private static final Set<String> ENGINE_FAULTS = Set.of(
            RouteReconstructor.REASON_PREDECESSOR_CYCLE,
            RouteReconstructor.REASON_PREDECESSOR_CHAIN_BROKEN,
            SearchBudget.REASON_EXPANSIONS_EXCEEDED
    );

    private final String reasonCode;

    public RouteSearchException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    /**
     * Creates a reason-coded search failure with a cause.
     *
     * @param reasonCode upper-case code in the {@code GR_} namespace.
     * @param message descriptive error message.
     * @param cause underlying cause, may be {@code null}.
     * @throws IllegalArgumentException if the code is outside the {@code GR_} namespace.
     */
    public RouteSearchException(String reasonCode, String message, Throwable cause) {
        super("[" + checkedCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"), cause);
        this.reasonCode = reasonCode;
    }

    /**
     * Whether the engine itself failed (corrupted predecessor chain or breached budget) rather
     * than refusing a malformed request.
     */
    public boolean isEngineFault() {
        return ENGINE_FAULTS.contains(reasonCode);
    }

    private static String checkedCode(String reasonCode) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (!REASON_CODE.matcher(reasonCode).matches()) {
            throw new IllegalArgumentException("reason code must look like GR_NAME, got '" + reasonCode + "'");
        }
        return reasonCode;
    }
}
