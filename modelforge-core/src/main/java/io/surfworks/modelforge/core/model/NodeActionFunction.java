package io.surfworks.modelforge.core.model;

/**
 * Decides the {@link NodeAction} for a node.
 *
 * <p>Implementations should be pure: the same node always yields the same action.
 */
@FunctionalInterface
public interface NodeActionFunction {

    NodeAction apply(Node node);
}
