package io.surfworks.modelforge.passes;

import io.surfworks.modelforge.core.model.Model;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.TransformContext;

/**
 * A whole-model rewrite step run by {@link ModelOptimizer}.
 *
 * <p>A pass builds its result through the transformer it is given, using one of the
 * transformer's top-level operations, so that the transformer's correspondence table
 * describes the pass when it returns. {@link ModelOptimizer} relies on that to trace
 * outputs of the original model through the whole pipeline.
 *
 * <p>Example implementation:
 * <pre>{@code
 * public class DropOutputsPass implements ModelPass {
 *     @Override
 *     public String name() { return "drop-outputs"; }
 *
 *     @Override
 *     public Model apply(Model model, TransformContext context, ModelTransformer transformer) {
 *         return transformer.transformModel(model, (node, t) -> {
 *             // ... rebuild or skip each node ...
 *         }, context);
 *     }
 * }
 * }</pre>
 */
public interface ModelPass {

    /**
     * Returns the unique name of this pass, as used in {@link OptimizerConfig}.
     *
     * @return the pass name (e.g., "fuse-linear", "refine")
     */
    String name();

    /**
     * Applies the pass.
     *
     * @param model the model to rewrite; not modified
     * @param context the policy for the pipeline
     * @param transformer the transformer to build the result with
     * @return the rewritten model
     */
    Model apply(Model model, TransformContext context, ModelTransformer transformer);

    /**
     * Returns a human-readable description of what this pass does.
     *
     * @return the pass description
     */
    default String description() {
        return name() + " pass";
    }
}
