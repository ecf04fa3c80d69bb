package io.lemon.core.workflow;

import java.util.Objects;

/// Directed edge between two blocks of a workflow.
///
/// @param id connection identifier, not null
/// @param fromBlock source block id, not null
/// @param fromPort source port, not null
/// @param toBlock target block id, not null and different from `fromBlock`
/// @param toPort target port, defaults to {@link PortType#DEFAULT}
public record Connection(
        String id, String fromBlock, PortType fromPort, String toBlock, PortType toPort) {

    public Connection {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(fromBlock, "fromBlock must not be null");
        Objects.requireNonNull(toBlock, "toBlock must not be null");
        fromPort = fromPort != null ? fromPort : PortType.DEFAULT;
        toPort = toPort != null ? toPort : PortType.DEFAULT;
        if (fromBlock.equals(toBlock)) {
            throw new IllegalArgumentException(
                    "Connection '" + id + "' cannot connect block '" + fromBlock + "' to itself");
        }
    }

    public static Connection of(String id, String fromBlock, PortType fromPort, String toBlock) {
        return new Connection(id, fromBlock, fromPort, toBlock, PortType.DEFAULT);
    }

    public static Connection of(String id, String fromBlock, String toBlock) {
        return new Connection(id, fromBlock, PortType.DEFAULT, toBlock, PortType.DEFAULT);
    }
}
