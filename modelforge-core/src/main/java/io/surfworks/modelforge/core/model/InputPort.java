package io.surfworks.modelforge.core.model;

import java.util.Objects;

/**
 * A named input of a node, wired to elements of upstream output ports.
 */
public final class InputPort {

    private final Node owner;
    private final String name;
    private final PortElements elements;

    InputPort(Node owner, String name, PortElements elements) {
        this.owner = owner;
        this.name = name;
        this.elements = Objects.requireNonNull(elements, "elements cannot be null");
    }

    public Node owner() {
        return owner;
    }

    public String name() {
        return name;
    }

    /**
     * Get the upstream elements this input reads.
     */
    public PortElements elements() {
        return elements;
    }

    public PortType type() {
        return elements.type();
    }

    public int size() {
        return elements.size();
    }

    @Override
    public String toString() {
        return name + "=" + elements;
    }
}
