package io.surfworks.modelforge.nodes;

import io.surfworks.modelforge.core.model.InputPort;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.OutputPort;
import io.surfworks.modelforge.core.model.PortElements;

/**
 * Squared L2 norm of its input.
 *
 * <p>Refines into {@link DotProductNode}{@code (x, x)}, which needs a second pass to reach
 * primitive nodes.
 */
public final class SquaredNormNode extends Node {

    private final InputPort input;
    private final OutputPort output;

    public SquaredNormNode(PortElements input) {
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
    public boolean isCompilable() {
        return false;
    }

    @Override
    protected void copy(ModelTransformer transformer) {
        PortElements newInput = transformer.transformPortElements(input.elements());
        SquaredNormNode newNode = transformer.addNode(new SquaredNormNode(newInput));
        transformer.mapNodeOutput(output, newNode.output());
    }

    @Override
    protected void refine(ModelTransformer transformer) {
        PortElements newInput = transformer.transformPortElements(input.elements());
        DotProductNode dot = transformer.addNode(new DotProductNode(newInput, newInput));
        transformer.mapNodeOutput(output, dot.output());
    }
}
