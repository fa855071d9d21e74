package io.surfworks.modelforge.core.model;

/**
 * A typed production point on a node.
 *
 * <p>The port's {@link PortAddress} becomes available once the owning node has been added
 * to a model.
 */
public final class OutputPort {

    private final Node owner;
    private final int index;
    private final String name;
    private final PortType type;
    private final int size;

    OutputPort(Node owner, int index, String name, PortType type, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Output port '" + name + "' must have at least one element");
        }
        this.owner = owner;
        this.index = index;
        this.name = name;
        this.type = type;
        this.size = size;
    }

    /**
     * Get the node producing this output.
     */
    public Node owner() {
        return owner;
    }

    /**
     * Get the index of this port among the owner's outputs.
     */
    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public PortType type() {
        return type;
    }

    /**
     * Get the number of elements this port produces.
     */
    public int size() {
        return size;
    }

    /**
     * Get the address of this port.
     *
     * @throws IllegalStateException if the owner has not been added to a model
     */
    public PortAddress address() {
        return new PortAddress(owner.id(), index);
    }

    @Override
    public String toString() {
        return owner.typeName() + "." + name + "<" + type + " x " + size + ">";
    }
}
