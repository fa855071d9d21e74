package io.surfworks.modelforge.passes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.modelforge.core.model.InputNode;
import io.surfworks.modelforge.core.model.Model;
import io.surfworks.modelforge.core.model.ModelStructureException;
import io.surfworks.modelforge.core.model.ModelTransformer;
import io.surfworks.modelforge.core.model.OutputNode;
import io.surfworks.modelforge.core.model.PortElements;
import io.surfworks.modelforge.core.model.PortType;
import io.surfworks.modelforge.core.model.TransformContext;
import io.surfworks.modelforge.nodes.AffineNode;

@DisplayName("FuseLinearOperationsPass")
class FuseLinearOperationsPassTest {

    private Model model;
    private InputNode x;
    private ModelTransformer transformer;
    private FuseLinearOperationsPass pass;

    @BeforeEach
    void setUp() {
        model = new Model();
        x = model.addNode(new InputNode(PortType.REAL, 4));
        transformer = new ModelTransformer();
        pass = new FuseLinearOperationsPass();
    }

    @Test
    @DisplayName("two chained affine nodes become one")
    void fusesPair() {
        AffineNode first = model.addNode(new AffineNode(PortElements.of(x.output()), 2.0, 1.0));
        AffineNode second = model.addNode(new AffineNode(PortElements.of(first.output()), 3.0, 0.5));
        model.addNode(new OutputNode(PortElements.of(second.output())));

        Model fused = pass.apply(model, new TransformContext(), transformer);

        assertEquals(3, fused.size());
        List<AffineNode> affines = fused.nodesOfType(AffineNode.class);
        assertEquals(1, affines.size());
        assertEquals(6.0, affines.get(0).scale(), 1e-12);
        assertEquals(3.5, affines.get(0).bias(), 1e-12);
        assertEquals(1, pass.lastFusionCount());
        assertEquals(1, pass.lastFoldedCount());

        assertEquals(PortElements.of(affines.get(0).output()), transformer.getCorrespondingOutputs(second.output()));
        assertEquals(PortElements.of(transformer.getCorrespondingInputNode(x).output()),
                affines.get(0).input().elements());
    }

    @Test
    @DisplayName("folded nodes have no counterpart")
    void foldedNodesAreUnmapped() {
        AffineNode first = model.addNode(new AffineNode(PortElements.of(x.output()), 2.0, 1.0));
        model.addNode(new AffineNode(PortElements.of(first.output()), 3.0, 0.5));

        pass.apply(model, new TransformContext(), transformer);

        var e = assertThrows(ModelStructureException.class, () -> transformer.getCorrespondingOutputs(first.output()));
        assertEquals(ModelStructureException.Reason.UNMAPPED_PORT, e.reason());
    }

    @Test
    @DisplayName("longer chains compose in order")
    void fusesChain() {
        AffineNode a = model.addNode(new AffineNode(PortElements.of(x.output()), 2.0, 0.0));
        AffineNode b = model.addNode(new AffineNode(PortElements.of(a.output()), 1.0, 1.0));
        model.addNode(new AffineNode(PortElements.of(b.output()), 2.0, 0.0));

        Model fused = pass.apply(model, new TransformContext(), transformer);

        AffineNode result = fused.nodesOfType(AffineNode.class).get(0);
        assertEquals(2, fused.size());
        assertEquals(4.0, result.scale(), 1e-12);
        assertEquals(2.0, result.bias(), 1e-12);
        assertEquals(2, pass.lastFoldedCount());
    }

    @Test
    @DisplayName("an affine node read by several consumers is kept")
    void keepsSharedNode() {
        AffineNode shared = model.addNode(new AffineNode(PortElements.of(x.output()), 2.0, 1.0));
        model.addNode(new AffineNode(PortElements.of(shared.output()), 3.0, 0.5));
        model.addNode(new OutputNode(PortElements.of(shared.output())));

        Model fused = pass.apply(model, new TransformContext(), transformer);

        assertTrue(fused.isStructurallyEqualTo(model));
        assertEquals(0, pass.lastFusionCount());
    }

    @Test
    @DisplayName("an affine node read only in part is kept")
    void keepsPartiallyReadNode() {
        AffineNode first = model.addNode(new AffineNode(PortElements.of(x.output()), 2.0, 1.0));
        model.addNode(new AffineNode(PortElements.of(first.output(), 0, 2), 3.0, 0.5));

        Model fused = pass.apply(model, new TransformContext(), transformer);

        assertEquals(2, fused.nodesOfType(AffineNode.class).size());
        assertEquals(0, pass.lastFoldedCount());
    }
}
