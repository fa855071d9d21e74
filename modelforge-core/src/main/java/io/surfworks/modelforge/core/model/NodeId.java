package io.surfworks.modelforge.core.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Stable identity of a node.
 *
 * <p>Identities are handed out once, when a node is added to a {@link Model}, and are
 * never reused, so an id from one model never resolves to a node of another.
 *
 * @param value the numeric identity
 */
public record NodeId(long value) implements Comparable<NodeId> {

    private static final AtomicLong NEXT = new AtomicLong();

    static NodeId next() {
        return new NodeId(NEXT.getAndIncrement());
    }

    @Override
    public int compareTo(NodeId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
