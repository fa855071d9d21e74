package io.surfworks.modelforge.passes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StandardPasses")
class StandardPassesTest {

    @Test
    @DisplayName("names in registration order")
    void names() {
        assertEquals(List.of("fuse-linear", "refine"), List.copyOf(StandardPasses.names()));
        assertTrue(StandardPasses.isRegistered("refine"));
        assertFalse(StandardPasses.isRegistered("inline"));
    }

    @Test
    @DisplayName("refine pass takes the configured bound")
    void refineTakesBound() {
        OptimizerConfig config = new OptimizerConfig(3, List.of(StandardPasses.REFINE));

        RefinePass pass = assertInstanceOf(RefinePass.class, StandardPasses.create(StandardPasses.REFINE, config));

        assertEquals(3, pass.maxIterations());
        assertEquals("refine", pass.name());
    }

    @Test
    @DisplayName("creates every configured pass in order")
    void createAll() {
        List<ModelPass> passes = StandardPasses.createAll(OptimizerConfig.defaults());

        assertEquals(2, passes.size());
        assertInstanceOf(FuseLinearOperationsPass.class, passes.get(0));
        assertInstanceOf(RefinePass.class, passes.get(1));
    }

    @Test
    @DisplayName("unknown name")
    void unknownName() {
        assertThrows(IllegalArgumentException.class,
                () -> StandardPasses.create("inline", OptimizerConfig.defaults()));
    }
}
