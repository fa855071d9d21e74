package io.surfworks.modelforge.core.model;

/**
 * Exception thrown when a model or a transformation would become structurally inconsistent.
 *
 * <p>These errors are reported at the point of detection and never defaulted:
 * <ul>
 *   <li>a node input refers to a port that is not part of the model it is added to</li>
 *   <li>a port range falls outside its port, or value types disagree</li>
 *   <li>a transformation translates or queries a port that was never mapped</li>
 *   <li>a correspondence query is made before any pass completed</li>
 * </ul>
 *
 * <p>Example:
 * <pre>{@code
 * try {
 *     PortElements moved = transformer.getCorrespondingOutputs(oldNode.output());
 * } catch (ModelStructureException e) {
 *     if (e.reason() == ModelStructureException.Reason.UNMAPPED_PORT) {
 *         // oldNode was outside the copied closure
 *     }
 * }
 * }</pre>
 */
public class ModelStructureException extends RuntimeException {

    /**
     * Kind of structural inconsistency detected.
     */
    public enum Reason {
        /** A port address has no old-to-new correspondence */
        UNMAPPED_PORT,
        /** An input refers to a node that is not in the model being built */
        DANGLING_REFERENCE,
        /** An element range does not fit inside its port */
        RANGE_OUT_OF_BOUNDS,
        /** Value types of connected ports disagree */
        TYPE_MISMATCH,
        /** Element counts of mapped ports disagree */
        SIZE_MISMATCH,
        /** A correspondence query was made with no completed pass */
        NO_COMPLETED_PASS,
        /** A node instance was added to a second model */
        NODE_ALREADY_ATTACHED,
        /** A node was added to a model that has been completed */
        MODEL_SEALED,
        /** A correspondence did not resolve to an input node */
        NOT_AN_INPUT_NODE,
        /** A node is not part of the model it was looked up in */
        UNKNOWN_NODE
    }

    private final Reason reason;

    /**
     * Creates a ModelStructureException.
     *
     * @param reason the kind of inconsistency
     * @param message the exception message
     */
    public ModelStructureException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * Returns the kind of inconsistency that was detected.
     *
     * @return the reason
     */
    public Reason reason() {
        return reason;
    }
}
