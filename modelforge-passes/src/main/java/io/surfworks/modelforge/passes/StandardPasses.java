package io.surfworks.modelforge.passes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Registry of the passes that can be named in an {@link OptimizerConfig}.
 */
public final class StandardPasses {

    public static final String FUSE_LINEAR = "fuse-linear";
    public static final String REFINE = "refine";

    private static final Map<String, Function<OptimizerConfig, ModelPass>> FACTORIES;

    static {
        Map<String, Function<OptimizerConfig, ModelPass>> factories = new LinkedHashMap<>();
        factories.put(FUSE_LINEAR, config -> new FuseLinearOperationsPass());
        factories.put(REFINE, config -> new RefinePass(config.maxRefinementIterations()));
        FACTORIES = Collections.unmodifiableMap(factories);
    }

    private StandardPasses() {} // Utility class

    /**
     * Returns the registered pass names, in registration order.
     */
    public static Set<String> names() {
        return FACTORIES.keySet();
    }

    public static boolean isRegistered(String name) {
        return FACTORIES.containsKey(name);
    }

    /**
     * Creates a pass by name.
     *
     * @param name the pass name
     * @param config settings for the pass
     * @return a new pass instance
     * @throws IllegalArgumentException if no pass has that name
     */
    public static ModelPass create(String name, OptimizerConfig config) {
        Function<OptimizerConfig, ModelPass> factory = FACTORIES.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown pass '" + name + "', expected one of " + names());
        }
        return factory.apply(config);
    }

    /**
     * Creates every pass listed in the configuration, in order.
     */
    public static List<ModelPass> createAll(OptimizerConfig config) {
        List<ModelPass> passes = new ArrayList<>();
        for (String name : config.passes()) {
            passes.add(create(name, config));
        }
        return passes;
    }
}
