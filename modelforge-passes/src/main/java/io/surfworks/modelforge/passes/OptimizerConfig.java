package io.surfworks.modelforge.passes;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import io.surfworks.modelforge.core.model.ModelTransformer;

/**
 * Configuration of an optimization pipeline.
 *
 * <p>Settings are resolved in this order, later sources winning:
 * <ol>
 *   <li>{@link #defaults()}</li>
 *   <li>a JSON document, e.g. {@code {"maxRefinementIterations": 4, "passes": ["refine"]}}</li>
 *   <li>environment variables {@value #ENV_MAX_REFINE_ITERATIONS} and {@value #ENV_PASSES}</li>
 * </ol>
 *
 * @param maxRefinementIterations the iteration bound handed to {@link RefinePass}
 * @param passes the pass names to run, in order
 */
public record OptimizerConfig(int maxRefinementIterations, List<String> passes) {

    /**
     * Environment variable overriding the refinement iteration bound.
     */
    public static final String ENV_MAX_REFINE_ITERATIONS = "MODELFORGE_MAX_REFINE_ITERATIONS";

    /**
     * Environment variable overriding the pass list (comma separated).
     */
    public static final String ENV_PASSES = "MODELFORGE_PASSES";

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    public OptimizerConfig {
        if (maxRefinementIterations < 0) {
            throw new IllegalArgumentException(
                    "maxRefinementIterations must be non-negative: " + maxRefinementIterations);
        }
        Objects.requireNonNull(passes, "passes cannot be null");
        for (String name : passes) {
            if (!StandardPasses.isRegistered(name)) {
                throw new IllegalArgumentException("Unknown pass '" + name + "', expected one of "
                        + StandardPasses.names());
            }
        }
        passes = List.copyOf(passes);
    }

    /**
     * Fuse linear operations, then refine with the default iteration bound.
     */
    public static OptimizerConfig defaults() {
        return new OptimizerConfig(ModelTransformer.DEFAULT_MAX_ITERATIONS,
                List.of(StandardPasses.FUSE_LINEAR, StandardPasses.REFINE));
    }

    /**
     * Parses a JSON document. Missing fields keep their default.
     *
     * @param json the document
     * @return the configuration
     * @throws IllegalArgumentException if the document is malformed or has invalid values
     */
    public static OptimizerConfig fromJson(String json) {
        ConfigFile file;
        try {
            file = GSON.fromJson(json, ConfigFile.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed optimizer configuration: " + e.getMessage(), e);
        }
        OptimizerConfig defaults = defaults();
        if (file == null) {
            return defaults;
        }
        return new OptimizerConfig(
            file.maxRefinementIterations != null ? file.maxRefinementIterations : defaults.maxRefinementIterations(),
            file.passes != null ? file.passes : defaults.passes()
        );
    }

    /**
     * Reads a JSON configuration file.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public static OptimizerConfig load(Path file) {
        try {
            return fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read optimizer configuration " + file, e);
        }
    }

    /**
     * Reads a JSON configuration from the classpath.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static OptimizerConfig fromResource(String resource) {
        try (InputStream in = OptimizerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Optimizer configuration not found on classpath: " + resource);
            }
            return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read optimizer configuration " + resource, e);
        }
    }

    /**
     * Applies overrides from the process environment.
     */
    public OptimizerConfig withEnvironmentOverrides() {
        return withEnvironmentOverrides(System.getenv());
    }

    /**
     * Applies overrides from the given environment.
     *
     * @param env variable name to value
     * @return the overridden configuration
     * @throws IllegalArgumentException if an override has an invalid value
     */
    public OptimizerConfig withEnvironmentOverrides(Map<String, String> env) {
        int iterations = maxRefinementIterations;
        List<String> names = passes;

        String iterationValue = env.get(ENV_MAX_REFINE_ITERATIONS);
        if (iterationValue != null && !iterationValue.isBlank()) {
            try {
                iterations = Integer.parseInt(iterationValue.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        ENV_MAX_REFINE_ITERATIONS + " is not an integer: " + iterationValue, e);
            }
        }

        String passValue = env.get(ENV_PASSES);
        if (passValue != null && !passValue.isBlank()) {
            names = new ArrayList<>();
            for (String name : Arrays.asList(passValue.split(","))) {
                if (!name.isBlank()) {
                    names.add(name.trim());
                }
            }
        }

        return new OptimizerConfig(iterations, names);
    }

    /**
     * Serializes this configuration as a JSON document.
     */
    public String toJson() {
        ConfigFile file = new ConfigFile();
        file.maxRefinementIterations = maxRefinementIterations;
        file.passes = passes;
        return GSON.toJson(file);
    }

    /**
     * Internal structure for JSON serialization.
     */
    private static class ConfigFile {
        Integer maxRefinementIterations;
        List<String> passes;
    }
}
