package io.surfworks.modelforge.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.modelforge.core.model.TestNodes.StubbornNode;

@DisplayName("TransformContext")
class TransformContextTest {

    private final Model model = new Model();
    private final InputNode input = model.addNode(new InputNode(PortType.REAL, 2));
    private final StubbornNode stubborn = model.addNode(new StubbornNode(PortElements.of(input.output())));

    @Test
    @DisplayName("without a function every node gets the default action")
    void defaultActionWithoutFunction() {
        TransformContext context = new TransformContext();

        assertFalse(context.hasNodeActionFunction());
        assertEquals(NodeAction.DEFAULT, context.getNodeAction(input));
        assertTrue(context.isNodeCompilable(input));
        assertFalse(context.isNodeCompilable(stubborn));
    }

    @Test
    @DisplayName("the function overrides the node's own opinion")
    void functionOverridesNode() {
        TransformContext context = new TransformContext(node ->
                node instanceof InputNode ? NodeAction.REFINE : NodeAction.COMPILE);

        assertFalse(context.isNodeCompilable(input));
        assertTrue(context.isNodeCompilable(stubborn));
    }

    @Test
    @DisplayName("a null answer falls back to the default action")
    void nullAnswerIsDefault() {
        TransformContext context = new TransformContext(node -> null);

        assertEquals(NodeAction.DEFAULT, context.getNodeAction(stubborn));
        assertFalse(context.isNodeCompilable(stubborn));
    }

    @Test
    @DisplayName("the function can be replaced and removed")
    void functionCanBeReplaced() {
        TransformContext context = new TransformContext();
        context.setNodeActionFunction(node -> NodeAction.COMPILE);
        assertTrue(context.isNodeCompilable(stubborn));

        context.setNodeActionFunction(null);
        assertFalse(context.hasNodeActionFunction());
        assertFalse(context.isNodeCompilable(stubborn));
    }
}
