package io.surfworks.modelforge.nodes;

import java.util.Map;
import java.util.Objects;

import io.surfworks.modelforge.core.model.InputPort;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.OutputPort;
import io.surfworks.modelforge.core.model.PortElements;

/**
 * Element-wise binary operation on two inputs of equal size and type.
 */
public final class BinaryOperationNode extends Node {

    /**
     * Supported element-wise operations.
     */
    public enum Operation {
        ADD,
        SUBTRACT,
        MULTIPLY,
        DIVIDE
    }

    private final Operation operation;
    private final InputPort input1;
    private final InputPort input2;
    private final OutputPort output;

    public BinaryOperationNode(PortElements input1, PortElements input2, Operation operation) {
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
        if (input1.size() != input2.size()) {
            throw new IllegalArgumentException(String.format(
                    "%s inputs must have the same size: %d vs %d", operation, input1.size(), input2.size()));
        }
        if (input1.type() != input2.type()) {
            throw new IllegalArgumentException(String.format(
                    "%s inputs must have the same type: %s vs %s", operation, input1.type(), input2.type()));
        }
        this.input1 = addInputPort("input1", input1);
        this.input2 = addInputPort("input2", input2);
        this.output = addOutputPort("output", input1.type(), input1.size());
    }

    public Operation operation() {
        return operation;
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
    public String typeName() {
        return "BinaryOperationNode(" + operation.name().toLowerCase() + ")";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("operation", operation);
    }

    @Override
    protected void copy(ModelTransformer transformer) {
        PortElements newInput1 = transformer.transformPortElements(input1.elements());
        PortElements newInput2 = transformer.transformPortElements(input2.elements());
        BinaryOperationNode newNode = transformer.addNode(new BinaryOperationNode(newInput1, newInput2, operation));
        transformer.mapNodeOutput(output, newNode.output());
    }
}
