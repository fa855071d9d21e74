package io.surfworks.modelforge.nodes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.OutputPort;
import io.surfworks.modelforge.core.model.PortType;

/**
 * A node producing fixed values.
 */
public final class ConstantNode extends Node {

    private final double[] values;
    private final OutputPort output;

    /**
     * Creates a constant node.
     *
     * @param type the value type of the output
     * @param values the values, at least one
     */
    public ConstantNode(PortType type, double... values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("ConstantNode needs at least one value");
        }
        this.values = values.clone();
        this.output = addOutputPort("output", type, values.length);
    }

    /**
     * Creates a constant node repeating one value.
     *
     * @param type the value type of the output
     * @param value the value
     * @param count how many times to repeat it
     * @return the node, not yet added to a model
     */
    public static ConstantNode filled(PortType type, double value, int count) {
        double[] values = new double[count];
        Arrays.fill(values, value);
        return new ConstantNode(type, values);
    }

    public OutputPort output() {
        return output;
    }

    public double[] values() {
        return values.clone();
    }

    @Override
    public Map<String, Object> attributes() {
        List<Double> boxed = new ArrayList<>(values.length);
        for (double v : values) {
            boxed.add(v);
        }
        return Map.of("values", boxed);
    }

    @Override
    protected void copy(ModelTransformer transformer) {
        ConstantNode newNode = transformer.addNode(new ConstantNode(output.type(), values));
        transformer.mapNodeOutput(output, newNode.output());
    }
}
