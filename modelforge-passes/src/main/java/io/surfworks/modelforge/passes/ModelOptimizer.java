package io.surfworks.modelforge.passes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import io.surfworks.modelforge.core.model.Model;
import io.surfworks.modelforge.core.model.ModelStructureException;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.OutputPort;
import io.surfworks.modelforge.core.model.PortAddress;
import io.surfworks.modelforge.core.model.PortElements;
import io.surfworks.modelforge.core.model.TransformContext;

/**
 * Runs a sequence of {@link ModelPass}es over a model.
 *
 * <p>Each pass reads the model produced by the previous one. The optimizer traces every
 * output port of the original model through all passes, so callers can locate original
 * results in the final model with {@link #getCorrespondingOutputs}.
 *
 * <p>Example usage:
 * <pre>{@code
 * ModelOptimizer optimizer = new ModelOptimizer()
 *     .addPass(new FuseLinearOperationsPass())
 *     .addPass(new RefinePass(4));
 *
 * Model optimized = optimizer.optimize(model, context);
 *
 * // Check pass statistics
 * for (PassResult r : optimizer.lastResults()) {
 *     System.out.println(r);
 * }
 * }</pre>
 */
public final class ModelOptimizer {

    private static final Logger LOG = Logger.getLogger(ModelOptimizer.class.getName());

    private final List<ModelPass> passes;
    private final List<PassResult> lastResults;
    private final Map<PortAddress, PortElements> correspondence;
    private boolean lastModelCompilable;
    private boolean optimized;

    /**
     * Creates an optimizer with no passes.
     *
     * <p>Use {@link #addPass(ModelPass)} to register passes. With no passes,
     * {@link #optimize} returns a copy.
     */
    public ModelOptimizer() {
        this(List.of());
    }

    /**
     * Creates an optimizer with the given passes.
     *
     * @param passes the passes to run, in order
     */
    public ModelOptimizer(List<ModelPass> passes) {
        this.passes = new ArrayList<>(passes);
        this.lastResults = new ArrayList<>();
        this.correspondence = new HashMap<>();
    }

    /**
     * Creates an optimizer running the passes named by the configuration.
     *
     * @param config the configuration
     * @return the optimizer
     */
    public static ModelOptimizer fromConfig(OptimizerConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return new ModelOptimizer(StandardPasses.createAll(config));
    }

    /**
     * Creates an optimizer with the standard pipeline: fuse linear operations, then refine.
     *
     * @return an optimizer with the standard passes
     */
    public static ModelOptimizer withStandardPasses() {
        return fromConfig(OptimizerConfig.defaults());
    }

    /**
     * Adds a pass at the end of the pipeline.
     *
     * @param pass the pass to add
     * @return this optimizer for chaining
     */
    public ModelOptimizer addPass(ModelPass pass) {
        passes.add(Objects.requireNonNull(pass, "pass cannot be null"));
        return this;
    }

    /**
     * Runs every pass in order.
     *
     * @param model the model to optimize; not modified
     * @param context the policy handed to each pass
     * @return the model produced by the last pass
     */
    public Model optimize(Model model, TransformContext context) {
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(context, "context cannot be null");
        lastResults.clear();
        correspondence.clear();
        optimized = false;

        ModelTransformer transformer = new ModelTransformer();
        Model current;
        if (passes.isEmpty()) {
            current = transformer.copyModel(model, context);
            trace(model, transformer, true);
        } else {
            current = model;
            boolean first = true;
            for (ModelPass pass : passes) {
                int before = current.size();
                current = pass.apply(current, context, transformer);
                trace(model, transformer, first);
                first = false;

                PassResult result = new PassResult(pass.name(), before, current.size(),
                        transformer.isModelCompilable());
                lastResults.add(result);
                LOG.fine(result.toString());
            }
        }

        lastModelCompilable = transformer.isModelCompilable();
        optimized = true;
        LOG.info(String.format("Optimized model: %d -> %d nodes in %d passes, compilable=%s",
                model.size(), current.size(), passes.size(), lastModelCompilable));
        return current;
    }

    private void trace(Model original, ModelTransformer transformer, boolean first) {
        if (first) {
            for (Node node : original.nodes()) {
                for (OutputPort port : node.outputs()) {
                    PortElements elements = PortElements.of(port);
                    if (transformer.hasCorrespondingOutputs(elements)) {
                        correspondence.put(port.address(), transformer.getCorrespondingOutputs(elements));
                    }
                }
            }
            return;
        }
        correspondence.replaceAll((address, elements) ->
                transformer.hasCorrespondingOutputs(elements) ? transformer.getCorrespondingOutputs(elements) : null);
        correspondence.values().removeIf(Objects::isNull);
    }

    /**
     * Returns the elements of the last optimized model holding the values of a port of the
     * original model.
     *
     * @param originalPort a port of the model passed to the last {@link #optimize} call
     * @return the corresponding elements
     * @throws ModelStructureException if nothing was optimized yet or the port was folded away
     */
    public PortElements getCorrespondingOutputs(OutputPort originalPort) {
        Objects.requireNonNull(originalPort, "originalPort cannot be null");
        requireOptimized();
        PortElements elements = correspondence.get(originalPort.address());
        if (elements == null) {
            throw new ModelStructureException(ModelStructureException.Reason.UNMAPPED_PORT,
                    "Port " + originalPort.address() + " has no counterpart in the optimized model");
        }
        return elements;
    }

    /**
     * Indicates whether the model returned by the last {@link #optimize} call is compilable.
     *
     * @throws ModelStructureException if nothing was optimized yet
     */
    public boolean isModelCompilable() {
        requireOptimized();
        return lastModelCompilable;
    }

    private void requireOptimized() {
        if (!optimized) {
            throw new ModelStructureException(ModelStructureException.Reason.NO_COMPLETED_PASS,
                    "No model has been optimized");
        }
    }

    /**
     * Returns per-pass statistics from the last {@link #optimize} call.
     */
    public List<PassResult> lastResults() {
        return List.copyOf(lastResults);
    }

    /**
     * Returns the registered passes.
     */
    public List<ModelPass> passes() {
        return List.copyOf(passes);
    }

    @Override
    public String toString() {
        return String.format("ModelOptimizer[passes=%d, lastResults=%d]", passes.size(), lastResults.size());
    }

    /**
     * Statistics of one pass.
     *
     * @param passName the pass name
     * @param nodesBefore node count of the pass input
     * @param nodesAfter node count of the pass output
     * @param compilable whether the pass output is compilable
     */
    public record PassResult(String passName, int nodesBefore, int nodesAfter, boolean compilable) {

        @Override
        public String toString() {
            return String.format("%s: %d -> %d nodes, compilable=%s", passName, nodesBefore, nodesAfter, compilable);
        }
    }
}
