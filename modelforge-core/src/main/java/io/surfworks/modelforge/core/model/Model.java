package io.surfworks.modelforge.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An append-only, dependency-ordered graph of {@link Node}s.
 *
 * <p>Every input of a node must refer to output ports of nodes already in the model when
 * the node is added, so insertion order is always a valid topological order and
 * {@link #nodes()} can be walked front to back.
 *
 * <p>Models returned by {@link ModelTransformer} are sealed: they are complete, and any
 * further {@link #addNode} fails.
 *
 * <p>Example:
 * <pre>{@code
 * Model model = new Model();
 * InputNode in = model.addNode(new InputNode(PortType.REAL, 4));
 * OutputNode out = model.addNode(new OutputNode(PortElements.of(in.output())));
 *
 * model.dependencies(out); // [in]
 * model.dependents(in);    // [out]
 * }</pre>
 */
public final class Model {

    private final List<Node> nodes = new ArrayList<>();
    private final Map<NodeId, Node> nodesById = new HashMap<>();
    private final Map<NodeId, List<Node>> dependents = new HashMap<>();
    private boolean sealed;

    /**
     * Adds a node, assigning it a fresh identity.
     *
     * @param node the node to add; must not belong to any model yet
     * @param <T> the node kind
     * @return the same node, now attached to this model
     * @throws ModelStructureException if an input refers outside this model, a range does
     *         not fit its port, value types disagree, or the model is sealed
     */
    public <T extends Node> T addNode(T node) {
        Objects.requireNonNull(node, "node cannot be null");
        if (sealed) {
            throw new ModelStructureException(ModelStructureException.Reason.MODEL_SEALED,
                    "Cannot add " + node.typeName() + " to a completed model");
        }
        if (node.isAttached()) {
            throw new ModelStructureException(ModelStructureException.Reason.NODE_ALREADY_ATTACHED,
                    node.typeName() + " " + node.id() + " already belongs to a model");
        }

        Set<Node> feeding = new LinkedHashSet<>();
        for (InputPort input : node.inputs()) {
            validateWiring(node, input, feeding);
        }

        NodeId id = NodeId.next();
        node.attach(this, id);
        nodes.add(node);
        nodesById.put(id, node);
        for (Node upstream : feeding) {
            dependents.computeIfAbsent(upstream.id(), k -> new ArrayList<>()).add(node);
        }
        return node;
    }

    private void validateWiring(Node node, InputPort input, Set<Node> feeding) {
        for (PortRange range : input.elements().ranges()) {
            Node upstream = nodesById.get(range.address().node());
            if (upstream == null) {
                throw new ModelStructureException(ModelStructureException.Reason.DANGLING_REFERENCE,
                        String.format("Input '%s' of %s refers to node %s, which is not in this model",
                                input.name(), node.typeName(), range.address().node()));
            }
            if (range.address().portIndex() >= upstream.outputs().size()) {
                throw new ModelStructureException(ModelStructureException.Reason.DANGLING_REFERENCE,
                        String.format("Input '%s' of %s refers to missing port %s",
                                input.name(), node.typeName(), range.address()));
            }
            OutputPort port = upstream.output(range.address().portIndex());
            if (range.start() > port.size() - range.size()) {
                throw new ModelStructureException(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS,
                        String.format("Input '%s' of %s reads %s but the port has %d elements",
                                input.name(), node.typeName(), range, port.size()));
            }
            if (port.type() != input.type()) {
                throw new ModelStructureException(ModelStructureException.Reason.TYPE_MISMATCH,
                        String.format("Input '%s' of %s expects %s but port %s produces %s",
                                input.name(), node.typeName(), input.type(), range.address(), port.type()));
            }
            feeding.add(upstream);
        }
    }

    /**
     * Get all nodes in dependency order.
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Get the number of nodes.
     */
    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Returns true if the node belongs to this model.
     */
    public boolean contains(Node node) {
        return node.isAttached() && nodesById.get(node.id()) == node;
    }

    /**
     * Looks up a node by identity.
     *
     * @throws ModelStructureException if no such node is in this model
     */
    public Node node(NodeId id) {
        Node node = nodesById.get(id);
        if (node == null) {
            throw new ModelStructureException(ModelStructureException.Reason.UNKNOWN_NODE,
                    "Node " + id + " is not in this model");
        }
        return node;
    }

    Node findNode(NodeId id) {
        return nodesById.get(id);
    }

    /**
     * Looks up the node owning a port.
     *
     * @throws ModelStructureException if the port's node is not in this model
     */
    public Node nodeProducing(PortAddress address) {
        return node(address.node());
    }

    /**
     * Looks up an output port by address.
     *
     * @throws ModelStructureException if the port is not in this model
     */
    public OutputPort outputPort(PortAddress address) {
        Node owner = nodeProducing(address);
        if (address.portIndex() >= owner.outputs().size()) {
            throw new ModelStructureException(ModelStructureException.Reason.UNKNOWN_NODE,
                    "Port " + address + " does not exist on " + owner.typeName());
        }
        return owner.output(address.portIndex());
    }

    /**
     * Returns the distinct nodes feeding the given node, in input order.
     */
    public List<Node> dependencies(Node node) {
        requireMember(node);
        Set<Node> result = new LinkedHashSet<>();
        for (InputPort input : node.inputs()) {
            for (PortAddress address : input.elements().referencedPorts()) {
                result.add(nodeProducing(address));
            }
        }
        return List.copyOf(result);
    }

    /**
     * Returns the nodes reading any output of the given node, in dependency order.
     */
    public List<Node> dependents(Node node) {
        requireMember(node);
        return List.copyOf(dependents.getOrDefault(node.id(), List.of()));
    }

    /**
     * Returns all nodes of the given kind, in dependency order.
     */
    public <T extends Node> List<T> nodesOfType(Class<T> kind) {
        List<T> result = new ArrayList<>();
        for (Node node : nodes) {
            if (kind.isInstance(node)) {
                result.add(kind.cast(node));
            }
        }
        return result;
    }

    /**
     * Returns the given nodes plus every node they transitively depend on, in dependency order.
     *
     * @param outputs the nodes that must be computable
     * @return the ancestor closure of {@code outputs}
     * @throws ModelStructureException if an output is not in this model
     */
    public List<Node> requiredNodes(Collection<? extends Node> outputs) {
        Set<Node> required = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> pending = new ArrayDeque<>();
        for (Node output : outputs) {
            requireMember(output);
            if (required.add(output)) {
                pending.push(output);
            }
        }
        while (!pending.isEmpty()) {
            Node current = pending.pop();
            for (Node upstream : dependencies(current)) {
                if (required.add(upstream)) {
                    pending.push(upstream);
                }
            }
        }

        List<Node> ordered = new ArrayList<>(required.size());
        for (Node node : nodes) {
            if (required.contains(node)) {
                ordered.add(node);
            }
        }
        return ordered;
    }

    /**
     * Compares the structure of two models independently of node identities.
     *
     * <p>Nodes are matched by position in dependency order. Matched nodes must have the same
     * kind, attributes and output ports, and their inputs must read the same elements of
     * matched upstream nodes.
     *
     * @param other the model to compare with
     * @return true if the models are structurally identical
     */
    public boolean isStructurallyEqualTo(Model other) {
        if (this == other) return true;
        if (nodes.size() != other.nodes.size()) return false;

        Map<NodeId, Integer> positions = positions();
        Map<NodeId, Integer> otherPositions = other.positions();
        for (int i = 0; i < nodes.size(); i++) {
            Node a = nodes.get(i);
            Node b = other.nodes.get(i);
            if (a.getClass() != b.getClass() || !a.attributes().equals(b.attributes())) {
                return false;
            }
            if (!sameOutputs(a, b) || a.inputs().size() != b.inputs().size()) {
                return false;
            }
            for (int j = 0; j < a.inputs().size(); j++) {
                if (!sameWiring(a.inputs().get(j).elements(), positions,
                        b.inputs().get(j).elements(), otherPositions)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean sameOutputs(Node a, Node b) {
        if (a.outputs().size() != b.outputs().size()) return false;
        for (int k = 0; k < a.outputs().size(); k++) {
            OutputPort pa = a.output(k);
            OutputPort pb = b.output(k);
            if (pa.type() != pb.type() || pa.size() != pb.size()) return false;
        }
        return true;
    }

    private static boolean sameWiring(PortElements a, Map<NodeId, Integer> positionsA,
                                      PortElements b, Map<NodeId, Integer> positionsB) {
        if (a.type() != b.type() || a.ranges().size() != b.ranges().size()) return false;
        for (int k = 0; k < a.ranges().size(); k++) {
            PortRange ra = a.ranges().get(k);
            PortRange rb = b.ranges().get(k);
            if (!positionsA.get(ra.address().node()).equals(positionsB.get(rb.address().node()))
                    || ra.address().portIndex() != rb.address().portIndex()
                    || ra.start() != rb.start()
                    || ra.size() != rb.size()) {
                return false;
            }
        }
        return true;
    }

    private Map<NodeId, Integer> positions() {
        Map<NodeId, Integer> positions = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            positions.put(nodes.get(i).id(), i);
        }
        return positions;
    }

    private void requireMember(Node node) {
        if (!contains(node)) {
            throw new ModelStructureException(ModelStructureException.Reason.UNKNOWN_NODE,
                    node.typeName() + " is not in this model");
        }
    }

    /**
     * Returns true once the model has been completed by a transformation pass.
     */
    public boolean isSealed() {
        return sealed;
    }

    void seal() {
        sealed = true;
    }

    /**
     * Returns a multi-line listing of the model's nodes.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Model\n");
        sb.append("  Nodes: ").append(nodes.size()).append("\n");
        Set<Class<?>> kinds = new HashSet<>();
        nodes.forEach(n -> kinds.add(n.getClass()));
        sb.append("  Kinds: ").append(kinds.size()).append("\n");
        for (int i = 0; i < nodes.size(); i++) {
            sb.append("    [").append(i).append("] ").append(nodes.get(i)).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("Model[nodes=%d, sealed=%s]", nodes.size(), sealed);
    }
}
