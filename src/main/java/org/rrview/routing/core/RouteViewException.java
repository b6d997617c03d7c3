package org.rrview.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Failure of a {@link RouteViewCore} query on a well-formed design.
 *
 * <p>Every failure carries a {@link Reason}. The reason's code prefixes the message as
 * {@code [RV_...] detail} so that log lines can be grepped by cause.</p>
 */
@Getter
public final class RouteViewException extends RuntimeException {

    /**
     * Why a query could not be answered.
     */
    public enum Reason {
        /** Net id or name not present in the netlist. */
        UNKNOWN_NET("RV_UNKNOWN_NET"),
        /** Global nets use dedicated networks and have no drawn route. */
        GLOBAL_NET("RV_GLOBAL_NET"),
        /** The net has an empty traceback. */
        NET_NOT_ROUTED("RV_NET_NOT_ROUTED"),
        /** Sink pin index outside {@code [1, pinCount)}. */
        SINK_PIN_OUT_OF_RANGE("RV_SINK_PIN_OUT_OF_RANGE"),
        NODE_OUT_OF_BOUNDS("RV_NODE_OUT_OF_BOUNDS"),
        /** The route does not start at the net's driver terminal. */
        ROUTE_TREE_ROOT_MISMATCH("RV_ROUTE_TREE_ROOT_MISMATCH");

        @Getter
        private final String code;

        Reason(String code) {
            this.code = code;
        }
    }

    private final Reason reason;

    public RouteViewException(Reason reason, String message) {
        super(formatMessage(reason, message));
        this.reason = reason;
    }

    public RouteViewException(Reason reason, String message, Throwable cause) {
        super(formatMessage(reason, message), cause);
        this.reason = reason;
    }

    /**
     * Stable string form of {@link #getReason()}.
     */
    public String getReasonCode() {
        return reason.getCode();
    }

    private static String formatMessage(Reason reason, String message) {
        Objects.requireNonNull(reason, "reason");
        return "[" + reason.getCode() + "] " + Objects.requireNonNull(message, "message");
    }
}
