package io.surfworks.modelforge.nodes;

import java.util.Map;

import io.surfworks.modelforge.core.model.InputPort;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.OutputPort;
import io.surfworks.modelforge.core.model.PortElements;

/**
 * Element-wise affine function {@code scale * x + bias}.
 *
 * <p>Refines into:
 * <pre>{@code
 * %s = constant(scale, ...)
 * %b = constant(bias, ...)
 * %0 = multiply(%x, %s)
 * %1 = add(%0, %b)
 * }</pre>
 */
public final class AffineNode extends Node {

    private final double scale;
    private final double bias;
    private final InputPort input;
    private final OutputPort output;

    public AffineNode(PortElements input, double scale, double bias) {
        if (!input.type().isFloatingPoint()) {
            throw new IllegalArgumentException("AffineNode requires floating point input, got " + input.type());
        }
        this.scale = scale;
        this.bias = bias;
        this.input = addInputPort("input", input);
        this.output = addOutputPort("output", input.type(), input.size());
    }

    public double scale() {
        return scale;
    }

    public double bias() {
        return bias;
    }

    public InputPort input() {
        return input;
    }

    public OutputPort output() {
        return output;
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("scale", scale, "bias", bias);
    }

    @Override
    public boolean isCompilable() {
        return false;
    }

    @Override
    protected void copy(ModelTransformer transformer) {
        PortElements newInput = transformer.transformPortElements(input.elements());
        AffineNode newNode = transformer.addNode(new AffineNode(newInput, scale, bias));
        transformer.mapNodeOutput(output, newNode.output());
    }

    @Override
    protected void refine(ModelTransformer transformer) {
        PortElements newInput = transformer.transformPortElements(input.elements());
        int size = newInput.size();

        ConstantNode scaleValues = transformer.addNode(ConstantNode.filled(newInput.type(), scale, size));
        ConstantNode biasValues = transformer.addNode(ConstantNode.filled(newInput.type(), bias, size));
        BinaryOperationNode scaled = transformer.addNode(new BinaryOperationNode(
                newInput, PortElements.of(scaleValues.output()), BinaryOperationNode.Operation.MULTIPLY));
        BinaryOperationNode shifted = transformer.addNode(new BinaryOperationNode(
                PortElements.of(scaled.output()), PortElements.of(biasValues.output()), BinaryOperationNode.Operation.ADD));

        transformer.mapNodeOutput(output, shifted.output());
    }
}
