package io.surfworks.modelforge.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Copies, refines and transforms models.
 *
 * <p>Every top-level call walks a source model in dependency order and asks each visited
 * node (or a caller-supplied function) to rebuild itself in a fresh destination model.
 * While doing so the transformer records, for every source output port, the elements of
 * the destination model that now hold its values. Nodes use that table through
 * {@link #transformPortElements} to rewire their inputs, and callers query it through
 * {@link #getCorrespondingOutputs} once the call has returned.
 *
 * <p>Example usage:
 * <pre>{@code
 * ModelTransformer transformer = new ModelTransformer();
 * Model refined = transformer.refineModel(model, context, 5);
 *
 * if (!transformer.isModelCompilable()) {
 *     // some nodes could not be lowered within 5 passes
 * }
 * PortElements result = transformer.getCorrespondingOutputs(oldOutput.output());
 * }</pre>
 *
 * <p>A transformer is single-threaded. The mapping and the compilability flag are reset
 * at the start of each top-level call and become queryable when it returns. If a node
 * fails during a pass the exception propagates unchanged and the transformer is left
 * with no model and no mapping.
 */
public final class ModelTransformer {

    private static final Logger LOG = Logger.getLogger(ModelTransformer.class.getName());

    /**
     * Refinement passes performed by {@link #refineModel(Model, TransformContext)}.
     */
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    private Model model;
    private Model source;
    private TransformContext context = new TransformContext();
    private Map<PortAddress, PortElements> elementMap = new HashMap<>();
    private boolean modelCompilable;
    private boolean passCompleted;
    private boolean inPass;
    private int refinementPassCount;

    // ==================== Top-level operations ====================

    /**
     * Returns a copy of the model, built by calling {@code copy} on every node.
     *
     * @param model the model to copy
     * @param context the context
     * @return the copied model
     */
    public Model copyModel(Model model, TransformContext context) {
        Objects.requireNonNull(model, "model cannot be null");
        return copyNodes(model, model.nodes(), context);
    }

    /**
     * Returns a copy of the part of the model needed to compute one output.
     *
     * @param model the model to copy
     * @param outputNode the node that must be computable in the result
     * @param context the context
     * @return the copied model
     */
    public Model copyModel(Model model, Node outputNode, TransformContext context) {
        Objects.requireNonNull(outputNode, "outputNode cannot be null");
        return copyModel(model, List.of(outputNode), context);
    }

    /**
     * Returns a copy of the part of the model needed to compute the given outputs.
     *
     * <p>Nodes that do not transitively feed any of {@code outputNodes} are skipped, and
     * their ports have no correspondence afterwards.
     *
     * @param model the model to copy
     * @param outputNodes the nodes that must be computable in the result
     * @param context the context
     * @return the copied model
     */
    public Model copyModel(Model model, Collection<? extends Node> outputNodes, TransformContext context) {
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(outputNodes, "outputNodes cannot be null");
        return copyNodes(model, model.requiredNodes(outputNodes), context);
    }

    private Model copyNodes(Model model, List<Node> visit, TransformContext context) {
        begin(context);
        try {
            Model result = runPass(model, visit, (node, transformer) -> node.copy(transformer));
            finish(result);
            LOG.fine("Copied " + visit.size() + " of " + model.size() + " nodes");
            return result;
        } catch (RuntimeException e) {
            abandon();
            throw e;
        }
    }

    /**
     * Refines the model with up to {@link #DEFAULT_MAX_ITERATIONS} passes.
     *
     * @see #refineModel(Model, TransformContext, int)
     */
    public Model refineModel(Model model, TransformContext context) {
        return refineModel(model, context, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Performs refinement passes until the model is compilable, a pass changes nothing, or
     * {@code maxIterations} passes have run.
     *
     * <p>In each pass, nodes whose action is {@link NodeAction#COMPILE} are copied and all
     * others are asked to refine themselves. With {@code maxIterations == 0} the result is a
     * plain copy. Correspondence queries afterwards resolve ports of {@code model} (not of
     * any intermediate pass) to the returned model.
     *
     * @param model the model to refine
     * @param context the context deciding per-node actions
     * @param maxIterations the maximum number of passes, at least 0
     * @return the model produced by the last pass
     */
    public Model refineModel(Model model, TransformContext context, int maxIterations) {
        Objects.requireNonNull(model, "model cannot be null");
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must be non-negative: " + maxIterations);
        }
        if (maxIterations == 0) {
            return copyModel(model, context);
        }

        begin(context);
        try {
            Model current = model;
            Map<PortAddress, PortElements> composed = null;
            boolean compilable = false;
            for (int iteration = 0; iteration < maxIterations; iteration++) {
                Model refined = runPass(current, current.nodes(), this::refineOrCopy);
                composed = composed == null ? elementMap : compose(composed, elementMap);
                refinementPassCount = iteration + 1;

                compilable = findUncompilableNodes(refined).isEmpty();
                boolean changed = !refined.isStructurallyEqualTo(current);
                LOG.fine(String.format("Refinement pass %d: %d -> %d nodes, compilable=%s, changed=%s",
                        refinementPassCount, current.size(), refined.size(), compilable, changed));
                current = refined;
                if (compilable || !changed) {
                    break;
                }
            }

            elementMap = composed;
            finish(current);
            if (!compilable && LOG.isLoggable(Level.WARNING)) {
                LOG.warning("Refinement stopped after " + refinementPassCount + " passes with "
                        + findUncompilableNodes(current).size() + " uncompilable nodes");
            }
            return current;
        } catch (RuntimeException e) {
            abandon();
            throw e;
        }
    }

    private void refineOrCopy(Node node, ModelTransformer transformer) {
        if (context.getNodeAction(node) == NodeAction.COMPILE) {
            node.copy(transformer);
        } else {
            node.refine(transformer);
        }
    }

    /**
     * Transforms the model by applying a function to every node.
     *
     * <p>The function takes the place of {@code copy}: for each node it builds whatever
     * replacement it wants through {@link #addNode} and maps the node's outputs through
     * {@link #mapNodeOutput}.
     *
     * @param model the model to transform
     * @param transformFunction the per-node action
     * @param context the context
     * @return the transformed model
     */
    public Model transformModel(Model model, NodeTransformFunction transformFunction, TransformContext context) {
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(transformFunction, "transformFunction cannot be null");
        begin(context);
        try {
            Model result = runPass(model, model.nodes(), transformFunction);
            finish(result);
            LOG.fine("Transformed " + model.size() + " nodes into " + result.size());
            return result;
        } catch (RuntimeException e) {
            abandon();
            throw e;
        }
    }

    /**
     * Indicates whether the model returned by the last top-level call is compilable.
     *
     * @return true if every node of the returned model is compilable under the context
     */
    public boolean isModelCompilable() {
        requirePassCompleted();
        return modelCompilable;
    }

    /**
     * Returns the number of refinement passes the last {@link #refineModel} call performed.
     * Zero after a copy or a generic transformation.
     */
    public int refinementPassCount() {
        return refinementPassCount;
    }

    // ==================== Correspondence queries ====================

    /**
     * Returns the elements of the new model corresponding to an output port of the old model.
     *
     * @param oldPort a port of the model passed to the last top-level call
     * @return the corresponding elements
     * @throws ModelStructureException if no pass completed or the port was never mapped
     */
    public PortElements getCorrespondingOutputs(OutputPort oldPort) {
        Objects.requireNonNull(oldPort, "oldPort cannot be null");
        requirePassCompleted();
        return translate(PortElements.of(oldPort), elementMap);
    }

    /**
     * Returns the elements of the new model corresponding to elements of the old model.
     *
     * @param oldElements elements of the model passed to the last top-level call
     * @return the corresponding elements
     * @throws ModelStructureException if no pass completed or a port was never mapped
     */
    public PortElements getCorrespondingOutputs(PortElements oldElements) {
        Objects.requireNonNull(oldElements, "oldElements cannot be null");
        requirePassCompleted();
        return translate(oldElements, elementMap);
    }

    /**
     * Returns true if every port referenced by {@code oldElements} has a correspondence
     * after the last completed top-level call.
     *
     * @param oldElements elements of the model passed to the last top-level call
     * @return false if no pass completed or any referenced port was never mapped
     */
    public boolean hasCorrespondingOutputs(PortElements oldElements) {
        Objects.requireNonNull(oldElements, "oldElements cannot be null");
        if (!passCompleted) {
            return false;
        }
        for (PortAddress address : oldElements.referencedPorts()) {
            if (!elementMap.containsKey(address)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the input node of the new model corresponding to an input node of the old model.
     *
     * @param oldNode an input node of the model passed to the last top-level call
     * @return the corresponding input node
     * @throws ModelStructureException if the output does not map onto a whole input node
     */
    public InputNode getCorrespondingInputNode(InputNode oldNode) {
        Objects.requireNonNull(oldNode, "oldNode cannot be null");
        PortElements elements = getCorrespondingOutputs(oldNode.output());
        if (elements.ranges().size() == 1) {
            PortRange range = elements.ranges().get(0);
            Node node = model.nodeProducing(range.address());
            if (node instanceof InputNode input && range.start() == 0 && range.size() == input.size()) {
                return input;
            }
        }
        throw new ModelStructureException(ModelStructureException.Reason.NOT_AN_INPUT_NODE,
                "Input node " + oldNode.id() + " maps to " + elements + ", which is not an input node");
    }

    // ==================== Functions used by node implementors ====================

    /**
     * Translates elements of the model being read into elements of the model being built.
     *
     * @param elements elements of the source model
     * @return the corresponding elements of the destination model
     * @throws ModelStructureException if a referenced port has not been mapped yet
     */
    public PortElements transformPortElements(PortElements elements) {
        Objects.requireNonNull(elements, "elements cannot be null");
        requireInPass("transformPortElements");
        return translate(elements, elementMap);
    }

    /**
     * Adds a node to the model being built.
     *
     * @param node a newly constructed node whose inputs refer to the destination model
     * @param <T> the node kind
     * @return the node, attached to the destination model
     * @throws ModelStructureException if the node's inputs refer outside the destination model
     */
    public <T extends Node> T addNode(T node) {
        requireInPass("addNode");
        return model.addNode(node);
    }

    /**
     * Copies a node of the model being read into the model being built.
     *
     * <p>Lets a {@link NodeTransformFunction} keep the nodes it does not rewrite.
     *
     * @param node a node of the model being read
     */
    public void copyNode(Node node) {
        Objects.requireNonNull(node, "node cannot be null");
        requireInPass("copyNode");
        requireInSource(node);
        node.copy(this);
    }

    /**
     * Asks a node of the model being read to refine itself into the model being built.
     *
     * @param node a node of the model being read
     */
    public void refineNode(Node node) {
        Objects.requireNonNull(node, "node cannot be null");
        requireInPass("refineNode");
        requireInSource(node);
        node.refine(this);
    }

    /**
     * Maps an old output port onto a new output port.
     *
     * @param oldPort a port of the node being visited
     * @param newPort a port of the destination model
     */
    public void mapNodeOutput(OutputPort oldPort, OutputPort newPort) {
        Objects.requireNonNull(newPort, "newPort cannot be null");
        mapNodeOutput(oldPort, PortElements.of(newPort));
    }

    /**
     * Maps an old output port onto elements of the destination model. Overwrites any earlier
     * mapping of the same port.
     *
     * @param oldPort a port of the model being read
     * @param newElements elements of the destination model with the same size and type
     * @throws ModelStructureException if either side is not in its model, or sizes or types disagree
     */
    public void mapNodeOutput(OutputPort oldPort, PortElements newElements) {
        Objects.requireNonNull(oldPort, "oldPort cannot be null");
        Objects.requireNonNull(newElements, "newElements cannot be null");
        requireInPass("mapNodeOutput");
        if (!source.contains(oldPort.owner())) {
            throw new ModelStructureException(ModelStructureException.Reason.UNKNOWN_NODE,
                    "Cannot map " + oldPort + ": its node is not in the model being transformed");
        }
        if (oldPort.type() != newElements.type()) {
            throw new ModelStructureException(ModelStructureException.Reason.TYPE_MISMATCH,
                    "Cannot map " + oldPort + " onto " + newElements.type() + " elements");
        }
        if (oldPort.size() != newElements.size()) {
            throw new ModelStructureException(ModelStructureException.Reason.SIZE_MISMATCH,
                    String.format("Cannot map %s of size %d onto %d elements",
                            oldPort, oldPort.size(), newElements.size()));
        }
        requireInDestination(newElements);
        elementMap.put(oldPort.address(), newElements);
    }

    /**
     * Maps old elements onto new elements, port by port.
     *
     * <p>Each range of {@code oldElements} must cover a whole port; that port is mapped onto
     * the matching slice of {@code newElements}.
     *
     * @param oldElements whole ports of the model being read
     * @param newElements elements of the destination model with the same size and type
     */
    public void mapNodeOutput(PortElements oldElements, PortElements newElements) {
        Objects.requireNonNull(oldElements, "oldElements cannot be null");
        Objects.requireNonNull(newElements, "newElements cannot be null");
        requireInPass("mapNodeOutput");
        if (oldElements.size() != newElements.size()) {
            throw new ModelStructureException(ModelStructureException.Reason.SIZE_MISMATCH,
                    String.format("Cannot map %d elements onto %d elements", oldElements.size(), newElements.size()));
        }
        int offset = 0;
        for (PortRange range : oldElements.ranges()) {
            OutputPort oldPort = source.outputPort(range.address());
            if (range.start() != 0 || range.size() != oldPort.size()) {
                throw new ModelStructureException(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS,
                        "Only whole ports can be mapped, but " + range + " covers part of " + oldPort);
            }
            mapNodeOutput(oldPort, newElements.slice(offset, range.size()));
            offset += range.size();
        }
    }

    /**
     * Get the context of the current or last top-level call.
     */
    public TransformContext context() {
        return context;
    }

    /**
     * Get the model being built, or the model returned by the last top-level call.
     */
    public Model model() {
        return model;
    }

    // ==================== Internal Helpers ====================

    private void begin(TransformContext newContext) {
        Objects.requireNonNull(newContext, "context cannot be null");
        this.context = newContext;
        this.model = null;
        this.source = null;
        this.elementMap = new HashMap<>();
        this.modelCompilable = false;
        this.passCompleted = false;
        this.refinementPassCount = 0;
    }

    private Model runPass(Model from, List<Node> visit, NodeTransformFunction action) {
        Model destination = new Model();
        this.source = from;
        this.model = destination;
        this.elementMap = new HashMap<>();
        this.inPass = true;
        try {
            for (Node node : visit) {
                action.transform(node, this);
            }
        } finally {
            this.inPass = false;
        }
        destination.seal();
        return destination;
    }

    private void finish(Model result) {
        this.model = result;
        this.source = null;
        this.modelCompilable = findUncompilableNodes(result).isEmpty();
        this.passCompleted = true;
    }

    private void abandon() {
        this.model = null;
        this.source = null;
        this.elementMap = new HashMap<>();
        this.modelCompilable = false;
        this.passCompleted = false;
        this.inPass = false;
    }

    private List<Node> findUncompilableNodes(Model candidate) {
        List<Node> result = new ArrayList<>();
        for (Node node : candidate.nodes()) {
            if (!context.isNodeCompilable(node)) {
                result.add(node);
            }
        }
        return result;
    }

    private static Map<PortAddress, PortElements> compose(Map<PortAddress, PortElements> earlier,
                                                          Map<PortAddress, PortElements> latest) {
        Map<PortAddress, PortElements> result = new HashMap<>(earlier.size());
        for (Map.Entry<PortAddress, PortElements> entry : earlier.entrySet()) {
            result.put(entry.getKey(), translate(entry.getValue(), latest));
        }
        return result;
    }

    private static PortElements translate(PortElements elements, Map<PortAddress, PortElements> mapping) {
        List<PortElements> parts = new ArrayList<>(elements.ranges().size());
        for (PortRange range : elements.ranges()) {
            PortElements mapped = mapping.get(range.address());
            if (mapped == null) {
                throw new ModelStructureException(ModelStructureException.Reason.UNMAPPED_PORT,
                        "Port " + range.address() + " has no corresponding elements");
            }
            parts.add(mapped.slice(range.start(), range.size()));
        }
        return parts.size() == 1 ? parts.get(0) : PortElements.concat(parts);
    }

    private void requireInDestination(PortElements elements) {
        for (PortRange range : elements.ranges()) {
            Node owner = model.findNode(range.address().node());
            if (owner == null) {
                throw new ModelStructureException(ModelStructureException.Reason.DANGLING_REFERENCE,
                        "Mapped elements refer to node " + range.address().node()
                                + ", which is not in the model being built");
            }
            if (range.address().portIndex() >= owner.outputs().size()
                    || range.start() > owner.output(range.address().portIndex()).size() - range.size()) {
                throw new ModelStructureException(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS,
                        "Mapped range " + range + " does not fit in the destination port");
            }
        }
    }

    private void requireInSource(Node node) {
        if (!source.contains(node)) {
            throw new ModelStructureException(ModelStructureException.Reason.UNKNOWN_NODE,
                    node.typeName() + " is not in the model being transformed");
        }
    }

    private void requireInPass(String operation) {
        if (!inPass) {
            throw new IllegalStateException(operation + " can only be called from a node during a transformation pass");
        }
    }

    private void requirePassCompleted() {
        if (!passCompleted) {
            throw new ModelStructureException(ModelStructureException.Reason.NO_COMPLETED_PASS,
                    "No transformation pass has completed");
        }
    }

    @Override
    public String toString() {
        return String.format("ModelTransformer[mapped=%d, compilable=%s, refinementPasses=%d]",
                elementMap.size(), modelCompilable, refinementPassCount);
    }
}
