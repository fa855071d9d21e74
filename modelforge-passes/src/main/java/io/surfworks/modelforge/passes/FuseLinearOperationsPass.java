package io.surfworks.modelforge.passes;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.modelforge.core.model.Model;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.PortElements;
import io.surfworks.modelforge.core.model.PortRange;
import io.surfworks.modelforge.core.model.TransformContext;
import io.surfworks.modelforge.nodes.AffineNode;

/**
 * Collapses chains of {@link AffineNode}s into a single affine node.
 *
 * <p>Two affine nodes compose into one:
 * <pre>{@code
 * s2 * (s1 * x + b1) + b2  ==  (s2 * s1) * x + (s2 * b1 + b2)
 * }</pre>
 *
 * <p>An affine node is folded into its consumer only if that consumer is the only node
 * reading it, is itself an affine node, and reads the whole output in order. Folded nodes
 * do not appear in the result, so their outputs have no correspondence after the pass.
 * Every other node is copied unchanged.
 */
public final class FuseLinearOperationsPass implements ModelPass {

    private static final Logger LOG = Logger.getLogger(FuseLinearOperationsPass.class.getName());

    private int lastFusionCount;
    private int lastFoldedCount;

    @Override
    public String name() {
        return StandardPasses.FUSE_LINEAR;
    }

    @Override
    public String description() {
        return "Fuses chains of affine operations into one affine operation";
    }

    @Override
    public Model apply(Model model, TransformContext context, ModelTransformer transformer) {
        Set<Node> folded = findFoldableNodes(model);
        lastFoldedCount = folded.size();
        lastFusionCount = 0;

        Model result = transformer.transformModel(model, (node, t) -> {
            if (folded.contains(node)) {
                return;
            }
            if (node instanceof AffineNode affine) {
                emitFused(affine, model, folded, t);
            } else {
                t.copyNode(node);
            }
        }, context);

        if (lastFusionCount > 0) {
            LOG.fine("Fused " + (lastFoldedCount + lastFusionCount) + " affine nodes into " + lastFusionCount);
        }
        return result;
    }

    private void emitFused(AffineNode last, Model model, Set<Node> folded, ModelTransformer transformer) {
        double scale = last.scale();
        double bias = last.bias();
        PortElements input = last.input().elements();

        AffineNode upstream = foldedProducer(input, model, folded);
        if (upstream != null) {
            lastFusionCount++;
        }
        while (upstream != null) {
            bias = scale * upstream.bias() + bias;
            scale = scale * upstream.scale();
            input = upstream.input().elements();
            upstream = foldedProducer(input, model, folded);
        }

        PortElements newInput = transformer.transformPortElements(input);
        AffineNode fused = transformer.addNode(new AffineNode(newInput, scale, bias));
        transformer.mapNodeOutput(last.output(), fused.output());
    }

    private static AffineNode foldedProducer(PortElements input, Model model, Set<Node> folded) {
        if (input.ranges().size() != 1) {
            return null;
        }
        PortRange range = input.ranges().get(0);
        Node producer = model.nodeProducing(range.address());
        return folded.contains(producer) ? (AffineNode) producer : null;
    }

    private static Set<Node> findFoldableNodes(Model model) {
        Set<Node> folded = Collections.newSetFromMap(new IdentityHashMap<>());
        for (AffineNode affine : model.nodesOfType(AffineNode.class)) {
            List<Node> consumers = model.dependents(affine);
            if (consumers.size() != 1 || !(consumers.get(0) instanceof AffineNode next)) {
                continue;
            }
            if (next.input().elements().equals(PortElements.of(affine.output()))) {
                folded.add(affine);
            }
        }
        return folded;
    }

    /**
     * Returns the number of fused affine nodes emitted by the last {@link #apply} call.
     */
    public int lastFusionCount() {
        return lastFusionCount;
    }

    /**
     * Returns the number of affine nodes folded into a consumer by the last {@link #apply} call.
     */
    public int lastFoldedCount() {
        return lastFoldedCount;
    }

    @Override
    public String toString() {
        return String.format("FuseLinearOperationsPass[lastFusions=%d, lastFolded=%d]",
                lastFusionCount, lastFoldedCount);
    }
}
