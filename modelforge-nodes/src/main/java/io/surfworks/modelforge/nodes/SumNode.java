package io.surfworks.modelforge.nodes;

import io.surfworks.modelforge.core.model.InputPort;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.OutputPort;
import io.surfworks.modelforge.core.model.PortElements;

/**
 * Sums all elements of its input into a single element.
 */
public final class SumNode extends Node {

    private final InputPort input;
    private final OutputPort output;

    public SumNode(PortElements input) {
        this.input = addInputPort("input", input);
        this.output = addOutputPort("output", input.type(), 1);
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
        SumNode newNode = transformer.addNode(new SumNode(newInput));
        transformer.mapNodeOutput(output, newNode.output());
    }
}
