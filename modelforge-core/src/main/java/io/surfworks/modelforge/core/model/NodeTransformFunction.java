package io.surfworks.modelforge.core.model;

/**
 * Per-node action of a generic transformation pass.
 *
 * <p>Called once per visited node, in dependency order. Like {@link Node#copy}, the
 * function must add the node's replacement to the transformer's destination model and map
 * the node's outputs, or deliberately leave them unmapped when the node is dropped.
 *
 * @see ModelTransformer#transformModel
 */
@FunctionalInterface
public interface NodeTransformFunction {

    void transform(Node node, ModelTransformer transformer);
}
