package io.surfworks.modelforge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A vertex of a {@link Model}: typed input wirings in, typed output ports out.
 *
 * <p>Concrete node kinds declare their ports in their constructor, through
 * {@link #addInputPort} and {@link #addOutputPort}, and implement {@link #copy}.
 * Once a node has been added to a model it is never mutated again; transformations
 * build new nodes in a destination model instead.
 *
 * <p>The engine talks to a node through exactly two entry points:
 * <ul>
 *   <li>{@link #copy} builds a structurally identical node in the transformer's
 *       destination model and maps this node's outputs onto it</li>
 *   <li>{@link #refine} may instead build an equivalent sub-graph of more primitive
 *       nodes; by default it copies</li>
 * </ul>
 *
 * <p>Example implementation:
 * <pre>{@code
 * public final class NegateNode extends Node {
 *     private final InputPort input;
 *     private final OutputPort output;
 *
 *     public NegateNode(PortElements input) {
 *         this.input = addInputPort("input", input);
 *         this.output = addOutputPort("output", input.type(), input.size());
 *     }
 *
 *     @Override
 *     protected void copy(ModelTransformer transformer) {
 *         PortElements newInput = transformer.transformPortElements(input.elements());
 *         NegateNode newNode = transformer.addNode(new NegateNode(newInput));
 *         transformer.mapNodeOutput(output, newNode.output);
 *     }
 * }
 * }</pre>
 */
public abstract class Node {

    private final List<InputPort> inputs = new ArrayList<>();
    private final List<OutputPort> outputs = new ArrayList<>();
    private NodeId id;
    private Model model;

    protected Node() {
    }

    /**
     * Declares an input. Only valid while the node is being constructed.
     *
     * @param name the input name
     * @param elements the upstream elements the input reads
     * @return the new input port
     */
    protected final InputPort addInputPort(String name, PortElements elements) {
        requireUnattached();
        InputPort port = new InputPort(this, name, elements);
        inputs.add(port);
        return port;
    }

    /**
     * Declares an output. Only valid while the node is being constructed.
     *
     * @param name the output name
     * @param type the value type produced
     * @param size the number of elements produced
     * @return the new output port
     */
    protected final OutputPort addOutputPort(String name, PortType type, int size) {
        requireUnattached();
        Objects.requireNonNull(type, "type cannot be null");
        OutputPort port = new OutputPort(this, outputs.size(), name, type, size);
        outputs.add(port);
        return port;
    }

    /**
     * Get the identity of this node.
     *
     * @throws IllegalStateException if the node has not been added to a model
     */
    public final NodeId id() {
        if (id == null) {
            throw new IllegalStateException(typeName() + " has not been added to a model");
        }
        return id;
    }

    /**
     * Returns true once the node has been added to a model.
     */
    public final boolean isAttached() {
        return id != null;
    }

    /**
     * Get the model this node belongs to, or null if it is not attached.
     */
    public final Model model() {
        return model;
    }

    public final List<InputPort> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public final List<OutputPort> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public final OutputPort output(int index) {
        return outputs.get(index);
    }

    /**
     * Get the name of this node kind, used in diagnostics.
     */
    public String typeName() {
        return getClass().getSimpleName();
    }

    /**
     * Returns the parameters that distinguish two nodes of the same kind with the same wiring.
     *
     * <p>Two passes that produce nodes with equal kinds, wiring and attributes are considered
     * to have made no progress. Nodes holding constants or an operation selector must
     * report them here.
     *
     * @return the attributes, empty by default
     */
    public Map<String, Object> attributes() {
        return Map.of();
    }

    /**
     * Returns the node's own opinion on whether it can be consumed without further refinement.
     *
     * <p>Consulted by {@link TransformContext#isNodeCompilable} when the installed decision
     * function does not decide for this node.
     */
    public boolean isCompilable() {
        return true;
    }

    /**
     * Builds an identical node in the transformer's destination model and maps this
     * node's outputs onto it.
     *
     * @param transformer the active transformer
     */
    protected abstract void copy(ModelTransformer transformer);

    /**
     * Builds an equivalent sub-graph in the transformer's destination model and maps this
     * node's outputs onto it. The default copies.
     *
     * @param transformer the active transformer
     */
    protected void refine(ModelTransformer transformer) {
        copy(transformer);
    }

    final void attach(Model owner, NodeId newId) {
        if (id != null) {
            throw new ModelStructureException(ModelStructureException.Reason.NODE_ALREADY_ATTACHED,
                    typeName() + " " + id + " already belongs to a model");
        }
        this.model = owner;
        this.id = newId;
    }

    private void requireUnattached() {
        if (id != null) {
            throw new IllegalStateException("Ports cannot be added to " + typeName() + " after it joined a model");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(typeName());
        if (id != null) {
            sb.append(id);
        }
        sb.append(" inputs=").append(inputs);
        sb.append(" outputs=[");
        for (int i = 0; i < outputs.size(); i++) {
            if (i > 0) sb.append(", ");
            OutputPort port = outputs.get(i);
            sb.append(port.type()).append(" x ").append(port.size());
        }
        sb.append("]");
        Map<String, Object> attrs = attributes();
        if (!attrs.isEmpty()) {
            sb.append(" ").append(attrs);
        }
        return sb.toString();
    }
}
