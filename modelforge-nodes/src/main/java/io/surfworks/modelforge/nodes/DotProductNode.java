package io.surfworks.modelforge.nodes;

import io.surfworks.modelforge.core.model.InputPort;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.OutputPort;
import io.surfworks.modelforge.core.model.PortElements;

/**
 * Dot product of two equally sized inputs. Refines into {@code sum(multiply(a, b))}.
 */
public final class DotProductNode extends Node {

    private final InputPort input1;
    private final InputPort input2;
    private final OutputPort output;

    public DotProductNode(PortElements input1, PortElements input2) {
        if (input1.size() != input2.size() || input1.type() != input2.type()) {
            throw new IllegalArgumentException("Dot product inputs must match: "
                    + input1.type() + " x " + input1.size() + " vs " + input2.type() + " x " + input2.size());
        }
        this.input1 = addInputPort("input1", input1);
        this.input2 = addInputPort("input2", input2);
        this.output = addOutputPort("output", input1.type(), 1);
    }

    public InputPort input1() {
        return input1;
    }

    public InputPort input2() {
        return input2;
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
        PortElements newInput1 = transformer.transformPortElements(input1.elements());
        PortElements newInput2 = transformer.transformPortElements(input2.elements());
        DotProductNode newNode = transformer.addNode(new DotProductNode(newInput1, newInput2));
        transformer.mapNodeOutput(output, newNode.output());
    }

    @Override
    protected void refine(ModelTransformer transformer) {
        PortElements newInput1 = transformer.transformPortElements(input1.elements());
        PortElements newInput2 = transformer.transformPortElements(input2.elements());
        BinaryOperationNode products = transformer.addNode(
                new BinaryOperationNode(newInput1, newInput2, BinaryOperationNode.Operation.MULTIPLY));
        SumNode sum = transformer.addNode(new SumNode(PortElements.of(products.output())));
        transformer.mapNodeOutput(output, sum.output());
    }
}
