package io.surfworks.modelforge.core.model;

/**
 * Marks elements as a model result. The output forwards the input unchanged.
 */
public final class OutputNode extends Node {

    private final InputPort input;
    private final OutputPort output;

    public OutputNode(PortElements input) {
        this.input = addInputPort("input", input);
        this.output = addOutputPort("output", input.type(), input.size());
    }

    public InputPort input() {
        return input;
    }

    public OutputPort output() {
        return output;
    }

    @Override
    protected void copy(ModelTransformer transformer) {
        PortElements newInput = transformer.transformPortElements(input.elements());
        OutputNode newNode = transformer.addNode(new OutputNode(newInput));
        transformer.mapNodeOutput(output, newNode.output());
    }
}
