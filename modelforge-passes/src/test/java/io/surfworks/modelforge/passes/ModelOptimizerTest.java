package io.surfworks.modelforge.passes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.modelforge.core.model.InputNode;
import io.surfworks.modelforge.core.model.Model;
import io.surfworks.modelforge.core.model.ModelStructureException;
import io.surfworks.modelforge.core.model.Node;
import io.surfworks.modelforge.core.model.OutputNode;
import io.surfworks.modelforge.core.model.PortElements;
import io.surfworks.modelforge.core.model.PortType;
import io.surfworks.modelforge.core.model.TransformContext;
import io.surfworks.modelforge.nodes.AffineNode;
import io.surfworks.modelforge.nodes.BinaryOperationNode;
import io.surfworks.modelforge.nodes.DotProductNode;
import io.surfworks.modelforge.nodes.SquaredNormNode;

@DisplayName("ModelOptimizer")
class ModelOptimizerTest {

    private Model model;
    private InputNode x;
    private AffineNode first;
    private AffineNode second;
    private OutputNode out;

    @BeforeEach
    void setUp() {
        model = new Model();
        x = model.addNode(new InputNode(PortType.REAL, 3));
        first = model.addNode(new AffineNode(PortElements.of(x.output()), 2.0, 1.0));
        second = model.addNode(new AffineNode(PortElements.of(first.output()), 3.0, 0.5));
        out = model.addNode(new OutputNode(PortElements.of(second.output())));
    }

    private static Node producerOf(Model result, PortElements elements) {
        assertEquals(1, elements.ranges().size());
        return result.nodeProducing(elements.ranges().get(0).address());
    }

    @Nested
    @DisplayName("Standard pipeline")
    class StandardPipelineTests {

        @Test
        @DisplayName("fuses then refines to a compilable model")
        void fusesThenRefines() {
            ModelOptimizer optimizer = ModelOptimizer.withStandardPasses();

            Model optimized = optimizer.optimize(model, new TransformContext());

            assertTrue(optimizer.isModelCompilable());
            assertTrue(optimized.nodesOfType(AffineNode.class).isEmpty());
            assertEquals(List.of(
                    new ModelOptimizer.PassResult(StandardPasses.FUSE_LINEAR, 4, 3, false),
                    new ModelOptimizer.PassResult(StandardPasses.REFINE, 3, 6, true)),
                    optimizer.lastResults());
        }

        @Test
        @DisplayName("original ports resolve through every pass")
        void originalPortsResolve() {
            ModelOptimizer optimizer = ModelOptimizer.withStandardPasses();

            Model optimized = optimizer.optimize(model, new TransformContext());

            BinaryOperationNode add = assertInstanceOf(BinaryOperationNode.class,
                    producerOf(optimized, optimizer.getCorrespondingOutputs(second.output())));
            assertEquals(BinaryOperationNode.Operation.ADD, add.operation());
            assertInstanceOf(OutputNode.class, producerOf(optimized, optimizer.getCorrespondingOutputs(out.output())));
            assertInstanceOf(InputNode.class, producerOf(optimized, optimizer.getCorrespondingOutputs(x.output())));
        }

        @Test
        @DisplayName("ports folded away by fusion are unmapped")
        void foldedPortsAreUnmapped() {
            ModelOptimizer optimizer = ModelOptimizer.withStandardPasses();
            optimizer.optimize(model, new TransformContext());

            var e = assertThrows(ModelStructureException.class,
                    () -> optimizer.getCorrespondingOutputs(first.output()));
            assertEquals(ModelStructureException.Reason.UNMAPPED_PORT, e.reason());
        }
    }

    @Nested
    @DisplayName("Custom pipelines")
    class CustomPipelineTests {

        @Test
        @DisplayName("no passes returns a copy")
        void noPassesCopies() {
            ModelOptimizer optimizer = new ModelOptimizer();

            Model optimized = optimizer.optimize(model, new TransformContext());

            assertTrue(optimized.isStructurallyEqualTo(model));
            assertTrue(optimizer.lastResults().isEmpty());
            assertFalse(optimizer.isModelCompilable());
            assertEquals(3, optimizer.getCorrespondingOutputs(first.output()).size());
        }

        @Test
        @DisplayName("passes run in the order they were added")
        void passesRunInOrder() {
            ModelOptimizer optimizer = new ModelOptimizer()
                    .addPass(new RefinePass(1))
                    .addPass(new FuseLinearOperationsPass());

            optimizer.optimize(model, new TransformContext());

            assertEquals(List.of(StandardPasses.REFINE, StandardPasses.FUSE_LINEAR),
                    optimizer.lastResults().stream().map(ModelOptimizer.PassResult::passName).toList());
            // nothing left to fuse once refinement removed the affine nodes
            assertEquals(optimizer.lastResults().get(0).nodesAfter(), optimizer.lastResults().get(1).nodesAfter());
        }

        @Test
        @DisplayName("configured iteration bound limits refinement")
        void configuredIterationBound() {
            Model norms = new Model();
            InputNode v = norms.addNode(new InputNode(PortType.REAL, 3));
            SquaredNormNode norm = norms.addNode(new SquaredNormNode(PortElements.of(v.output())));
            ModelOptimizer optimizer = ModelOptimizer.fromConfig(
                    new OptimizerConfig(1, List.of(StandardPasses.REFINE)));

            Model optimized = optimizer.optimize(norms, new TransformContext());

            assertFalse(optimizer.isModelCompilable());
            assertInstanceOf(DotProductNode.class, producerOf(optimized, optimizer.getCorrespondingOutputs(norm.output())));
        }

        @Test
        @DisplayName("queries before optimizing fail")
        void queryBeforeOptimize() {
            ModelOptimizer optimizer = ModelOptimizer.withStandardPasses();

            var e = assertThrows(ModelStructureException.class, () -> optimizer.getCorrespondingOutputs(x.output()));
            assertEquals(ModelStructureException.Reason.NO_COMPLETED_PASS, e.reason());
            var compilable = assertThrows(ModelStructureException.class, optimizer::isModelCompilable);
            assertEquals(ModelStructureException.Reason.NO_COMPLETED_PASS, compilable.reason());
            assertEquals(2, optimizer.passes().size());
        }
    }
}
