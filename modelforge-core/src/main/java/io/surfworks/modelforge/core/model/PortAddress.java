package io.surfworks.modelforge.core.model;

import java.util.Objects;

/**
 * Identity of one output port: the owning node plus the port's index on that node.
 *
 * <p>Used as the key of the old-to-new correspondence kept by {@link ModelTransformer}.
 *
 * @param node the id of the node owning the port
 * @param portIndex the index of the port among the node's outputs
 */
public record PortAddress(NodeId node, int portIndex) {

    public PortAddress {
        Objects.requireNonNull(node, "node cannot be null");
        if (portIndex < 0) {
            throw new IllegalArgumentException("portIndex must be non-negative: " + portIndex);
        }
    }

    @Override
    public String toString() {
        return node + "." + portIndex;
    }
}
