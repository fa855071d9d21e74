package io.surfworks.modelforge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered reference to elements of one or more output ports.
 *
 * <p>PortElements is the wiring of a node input: a sequence of {@link PortRange}s, each
 * naming a port and a run of its elements, plus the value type shared by all of them.
 * The element count is the sum of the range sizes.
 *
 * <p>Adjacent ranges that continue each other on the same port are merged on construction,
 * so two PortElements referring to the same elements in the same order are equal regardless
 * of how they were assembled.
 *
 * <p>Example:
 * <pre>{@code
 * // all four elements of a, then elements 2..3 of b
 * PortElements wiring = PortElements.concat(List.of(
 *     PortElements.of(a.output()),
 *     PortElements.of(b.output(), 2, 2)));
 *
 * wiring.size();   // 6
 * wiring.ranges(); // [#0.0[0..4), #1.0[2..4)]
 * }</pre>
 */
public final class PortElements {

    private final PortType type;
    private final List<PortRange> ranges;
    private final int size;

    /**
     * Creates port elements from explicit ranges.
     *
     * @param type the value type of every referenced port
     * @param ranges the ranges, in order; must not be empty
     */
    public PortElements(PortType type, List<PortRange> ranges) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(ranges, "ranges cannot be null");
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("PortElements must reference at least one range");
        }
        this.ranges = Collections.unmodifiableList(consolidate(ranges));
        this.size = this.ranges.stream().mapToInt(PortRange::size).sum();
    }

    /**
     * References every element of an output port.
     *
     * @param port the port
     * @return elements covering the whole port
     */
    public static PortElements of(OutputPort port) {
        return new PortElements(port.type(), List.of(new PortRange(port.address(), 0, port.size())));
    }

    /**
     * References a run of elements of an output port.
     *
     * @param port the port
     * @param start index of the first element
     * @param size number of elements
     * @return elements covering the requested run
     * @throws ModelStructureException if the run does not fit in the port
     */
    public static PortElements of(OutputPort port, int start, int size) {
        if (start < 0 || size <= 0 || start > port.size() - size) {
            throw new ModelStructureException(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS,
                    String.format("Range [start=%d, size=%d] does not fit in port %s of size %d",
                            start, size, port.address(), port.size()));
        }
        return new PortElements(port.type(), List.of(new PortRange(port.address(), start, size)));
    }

    /**
     * References a single element of an output port.
     */
    public static PortElements element(OutputPort port, int index) {
        return of(port, index, 1);
    }

    /**
     * Concatenates several port elements into one.
     *
     * @param parts the parts, in order
     * @return the concatenation
     * @throws ModelStructureException if the parts have different value types
     */
    public static PortElements concat(List<PortElements> parts) {
        Objects.requireNonNull(parts, "parts cannot be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Cannot concatenate an empty list of port elements");
        }
        PortType type = parts.get(0).type();
        List<PortRange> ranges = new ArrayList<>();
        for (PortElements part : parts) {
            if (part.type() != type) {
                throw new ModelStructureException(ModelStructureException.Reason.TYPE_MISMATCH,
                        "Cannot concatenate " + part.type() + " elements onto " + type + " elements");
            }
            ranges.addAll(part.ranges());
        }
        return new PortElements(type, ranges);
    }

    /**
     * Returns the value type of the referenced elements.
     */
    public PortType type() {
        return type;
    }

    /**
     * Returns the ranges making up these elements, in order.
     */
    public List<PortRange> ranges() {
        return ranges;
    }

    /**
     * Returns the total number of referenced elements.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the distinct ports referenced, in first-use order.
     */
    public Set<PortAddress> referencedPorts() {
        Set<PortAddress> ports = new LinkedHashSet<>();
        for (PortRange range : ranges) {
            ports.add(range.address());
        }
        return ports;
    }

    /**
     * Returns a contiguous sub-sequence of these elements.
     *
     * @param start index of the first element to keep
     * @param count number of elements to keep
     * @return the selected elements
     * @throws ModelStructureException if the selection does not fit
     */
    public PortElements slice(int start, int count) {
        if (start < 0 || count <= 0 || start > size - count) {
            throw new ModelStructureException(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS,
                    String.format("Slice [start=%d, size=%d] does not fit in %d elements", start, count, size));
        }
        if (start == 0 && count == size) {
            return this;
        }

        List<PortRange> result = new ArrayList<>();
        int offset = 0;
        int remaining = count;
        for (PortRange range : ranges) {
            if (remaining == 0) {
                break;
            }
            int rangeEnd = offset + range.size();
            if (rangeEnd > start) {
                int skip = Math.max(0, start - offset);
                int take = Math.min(range.size() - skip, remaining);
                result.add(new PortRange(range.address(), range.start() + skip, take));
                remaining -= take;
            }
            offset = rangeEnd;
        }
        return new PortElements(type, result);
    }

    private static List<PortRange> consolidate(List<PortRange> ranges) {
        List<PortRange> merged = new ArrayList<>(ranges.size());
        for (PortRange range : ranges) {
            Objects.requireNonNull(range, "range cannot be null");
            if (!merged.isEmpty()) {
                PortRange last = merged.get(merged.size() - 1);
                if (last.isContiguousWith(range)) {
                    merged.set(merged.size() - 1,
                            new PortRange(last.address(), last.start(), last.size() + range.size()));
                    continue;
                }
            }
            merged.add(range);
        }
        return merged;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PortElements other)) return false;
        return type == other.type && ranges.equals(other.ranges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, ranges);
    }

    @Override
    public String toString() {
        return "PortElements" + ranges + ":" + type;
    }
}
