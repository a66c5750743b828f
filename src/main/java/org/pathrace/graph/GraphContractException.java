package org.pathrace.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a graph model value violates its construction contract.
 *
 * <p>Messages are prefixed with deterministic reason-code text for observability.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GraphContractException extends RuntimeException {
    public static final String REASON_NODE_ID_REQUIRED = "GRAPH_NODE_ID_REQUIRED";
    public static final String REASON_DUPLICATE_NODE_ID = "GRAPH_DUPLICATE_NODE_ID";
    public static final String REASON_NON_FINITE_COORDINATE = "GRAPH_NON_FINITE_COORDINATE";
    public static final String REASON_EDGE_ENDPOINT_REQUIRED = "GRAPH_EDGE_ENDPOINT_REQUIRED";
    public static final String REASON_NON_POSITIVE_WEIGHT = "GRAPH_NON_POSITIVE_WEIGHT";
    public static final String REASON_GENERATOR_ARGUMENT = "GRAPH_GENERATOR_ARGUMENT";

    private final String reasonCode;

    /**
     * Creates a reason-coded graph contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public GraphContractException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
