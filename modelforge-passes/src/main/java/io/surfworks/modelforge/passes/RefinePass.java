package io.surfworks.modelforge.passes;

import io.surfworks.modelforge.core.model.Model;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.TransformContext;

/**
 * Lowers nodes until the model is compilable, through {@link ModelTransformer#refineModel}.
 */
public final class RefinePass implements ModelPass {

    private final int maxIterations;

    public RefinePass() {
        this(ModelTransformer.DEFAULT_MAX_ITERATIONS);
    }

    public RefinePass(int maxIterations) {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must be non-negative: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public int maxIterations() {
        return maxIterations;
    }

    @Override
    public String name() {
        return StandardPasses.REFINE;
    }

    @Override
    public String description() {
        return "Refines nodes into compilable primitives (up to " + maxIterations + " passes)";
    }

    @Override
    public Model apply(Model model, TransformContext context, ModelTransformer transformer) {
        return transformer.refineModel(model, context, maxIterations);
    }

    @Override
    public String toString() {
        return "RefinePass[maxIterations=" + maxIterations + "]";
    }
}
