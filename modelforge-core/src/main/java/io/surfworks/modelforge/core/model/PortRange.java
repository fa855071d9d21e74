package io.surfworks.modelforge.core.model;

import java.util.Objects;

/**
 * A contiguous run of elements taken from a single output port.
 *
 * @param address the port the elements come from
 * @param start index of the first element within the port
 * @param size number of elements
 */
public record PortRange(PortAddress address, int start, int size) {

    public PortRange {
        Objects.requireNonNull(address, "address cannot be null");
        if (start < 0 || size <= 0 || start > Integer.MAX_VALUE - size) {
            throw new ModelStructureException(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS,
                    String.format("Invalid range [start=%d, size=%d] on port %s", start, size, address));
        }
    }

    /**
     * Index one past the last element of this range.
     */
    public int end() {
        return start + size;
    }

    /**
     * Returns true if {@code next} continues this range on the same port without a gap.
     */
    public boolean isContiguousWith(PortRange next) {
        return address.equals(next.address) && end() == next.start;
    }

    @Override
    public String toString() {
        return address + "[" + start + ".." + end() + ")";
    }
}
