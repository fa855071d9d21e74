package io.surfworks.modelforge.core.model;

import java.util.Objects;

/**
 * Policy carried through a transformation: which nodes to refine and which are
 * compilation targets.
 *
 * <p>The context holds one optional {@link NodeActionFunction}. Without one, every node
 * gets {@link NodeAction#DEFAULT}.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Everything except affine nodes can be handed to the backend as-is
 * TransformContext context = new TransformContext(node ->
 *     node instanceof AffineNode ? NodeAction.REFINE : NodeAction.COMPILE);
 *
 * Model refined = new ModelTransformer().refineModel(model, context);
 * }</pre>
 */
public final class TransformContext {

    private NodeActionFunction nodeActionFunction;

    /**
     * Creates a context with no decision function.
     */
    public TransformContext() {
        this.nodeActionFunction = null;
    }

    /**
     * Creates a context with the given decision function.
     *
     * @param nodeActionFunction decides the action per node
     */
    public TransformContext(NodeActionFunction nodeActionFunction) {
        this.nodeActionFunction = Objects.requireNonNull(nodeActionFunction, "nodeActionFunction cannot be null");
    }

    /**
     * Replaces the decision function. Affects later queries only.
     *
     * @param nodeActionFunction the new function, or null to remove it
     */
    public void setNodeActionFunction(NodeActionFunction nodeActionFunction) {
        this.nodeActionFunction = nodeActionFunction;
    }

    /**
     * Returns true if a decision function is installed.
     */
    public boolean hasNodeActionFunction() {
        return nodeActionFunction != null;
    }

    /**
     * Gets the action to take on a node.
     *
     * @param node the node
     * @return the installed function's answer, or {@link NodeAction#DEFAULT} without one
     */
    public NodeAction getNodeAction(Node node) {
        if (nodeActionFunction == null) {
            return NodeAction.DEFAULT;
        }
        NodeAction action = nodeActionFunction.apply(node);
        return action != null ? action : NodeAction.DEFAULT;
    }

    /**
     * Returns true if the node needs no further refinement.
     *
     * <p>{@link NodeAction#COMPILE} means compilable and {@link NodeAction#REFINE} means not.
     * For {@link NodeAction#DEFAULT} the node's own {@link Node#isCompilable()} answers.
     *
     * @param node the node
     * @return true if the node is compilable
     */
    public boolean isNodeCompilable(Node node) {
        return switch (getNodeAction(node)) {
            case COMPILE -> true;
            case REFINE -> false;
            case DEFAULT -> node.isCompilable();
        };
    }

    @Override
    public String toString() {
        return "TransformContext[actionFunction=" + (nodeActionFunction != null ? "set" : "none") + "]";
    }
}
