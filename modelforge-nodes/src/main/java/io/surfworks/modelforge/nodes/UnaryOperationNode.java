package io.surfworks.modelforge.nodes;

import java.util.Map;
import java.util.Objects;

import io.surfworks.modelforge.core.model.InputPort;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.OutputPort;
import io.surfworks.modelforge.core.model.PortElements;

/**
 * Element-wise unary operation.
 *
 * <p>{@link Operation#SQUARE} has no direct lowering; it refines into
 * {@code multiply(x, x)}.
 */
public final class UnaryOperationNode extends Node {

    /**
     * Supported element-wise operations.
     */
    public enum Operation {
        NEGATE,
        ABS,
        SQRT,
        EXP,
        LOG,
        SQUARE
    }

    private final Operation operation;
    private final InputPort input;
    private final OutputPort output;

    public UnaryOperationNode(PortElements input, Operation operation) {
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
        this.input = addInputPort("input", input);
        this.output = addOutputPort("output", input.type(), input.size());
    }

    public Operation operation() {
        return operation;
    }

    public InputPort input() {
        return input;
    }

    public OutputPort output() {
        return output;
    }

    @Override
    public String typeName() {
        return "UnaryOperationNode(" + operation.name().toLowerCase() + ")";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("operation", operation);
    }

    @Override
    public boolean isCompilable() {
        return operation != Operation.SQUARE;
    }

    @Override
    protected void copy(ModelTransformer transformer) {
        PortElements newInput = transformer.transformPortElements(input.elements());
        UnaryOperationNode newNode = transformer.addNode(new UnaryOperationNode(newInput, operation));
        transformer.mapNodeOutput(output, newNode.output());
    }

    @Override
    protected void refine(ModelTransformer transformer) {
        if (operation != Operation.SQUARE) {
            copy(transformer);
            return;
        }
        PortElements newInput = transformer.transformPortElements(input.elements());
        BinaryOperationNode product = transformer.addNode(
                new BinaryOperationNode(newInput, newInput, BinaryOperationNode.Operation.MULTIPLY));
        transformer.mapNodeOutput(output, product.output());
    }
}
