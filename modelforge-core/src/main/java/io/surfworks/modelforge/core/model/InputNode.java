package io.surfworks.modelforge.core.model;

import java.util.Map;

/**
 * A model input: no inputs, one output of fixed type and size.
 */
public final class InputNode extends Node {

    private final OutputPort output;

    public InputNode(PortType type, int size) {
        this.output = addOutputPort("output", type, size);
    }

    public OutputPort output() {
        return output;
    }

    public PortType type() {
        return output.type();
    }

    public int size() {
        return output.size();
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("size", output.size());
    }

    @Override
    protected void copy(ModelTransformer transformer) {
        InputNode newNode = transformer.addNode(new InputNode(output.type(), output.size()));
        transformer.mapNodeOutput(output, newNode.output());
    }
}
