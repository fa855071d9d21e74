package io.surfworks.modelforge.core.model;

/**
 * What a transformation should do with a node during refinement.
 */
public enum NodeAction {
    /** Let the node decide: its own refine behavior and compilability apply */
    DEFAULT,
    /** Refine the node; it is not compilable as-is */
    REFINE,
    /** The node is a compilation target; copy it unchanged */
    COMPILE
}
