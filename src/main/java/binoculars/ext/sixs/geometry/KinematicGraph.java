package binoculars.ext.sixs.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of mechanically stacked rotation stages.
 *
 * <p>An edge {@code parent → child} means the child stage is mounted on the parent
 * stage, so the child rotates with everything below it. The graph is kept a forest:
 * every node has at most one parent and no edge may close a cycle. With that invariant
 * the path from a root to any node is unique.
 *
 * <p>Graphs are built once per diffractometer type and then only read. Use
 * {@link #unmodifiableCopy()} before sharing an instance between threads.
 */
public class KinematicGraph {
    private static final Logger logger = LoggerFactory.getLogger(KinematicGraph.class);

    private final Map<String, AxisNode> nodes;
    private final Map<String, List<String>> children;
    private final Map<String, String> parents;
    private final boolean readOnly;

    public KinematicGraph() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>(), new HashMap<>(), false);
    }

    private KinematicGraph(Map<String, AxisNode> nodes,
                           Map<String, List<String>> children,
                           Map<String, String> parents,
                           boolean readOnly) {
        this.nodes = nodes;
        this.children = children;
        this.parents = parents;
        this.readOnly = readOnly;
    }

    /**
     * Adds a stage. Adding a stage with an existing name replaces its axis.
     *
     * @return this graph for chaining
     */
    public KinematicGraph addNode(AxisNode node) {
        checkWritable();
        AxisNode previous = nodes.put(node.name(), node);
        children.putIfAbsent(node.name(), new ArrayList<>());
        if (previous != null && !previous.equals(node)) {
            logger.warn("Replaced axis {} with {}", previous, node);
        }
        return this;
    }

    /**
     * Mounts {@code child} on {@code parent}.
     *
     * @return this graph for chaining
     * @throws IllegalArgumentException if a node is unknown, the child already has a parent,
     *                                  or the edge would create a cycle
     */
    public KinematicGraph addEdge(String parent, String child) {
        checkWritable();
        requireNode(parent);
        requireNode(child);

        String existing = parents.get(child);
        if (existing != null) {
            if (existing.equals(parent)) {
                return this;
            }
            throw new IllegalArgumentException(String.format(
                    "Axis '%s' is already mounted on '%s', cannot mount it on '%s'", child, existing, parent));
        }
        for (String ancestor = parent; ancestor != null; ancestor = parents.get(ancestor)) {
            if (ancestor.equals(child)) {
                throw new IllegalArgumentException(String.format(
                        "Mounting '%s' on '%s' would create a cycle", child, parent));
            }
        }

        parents.put(child, parent);
        children.get(parent).add(child);
        return this;
    }

    /**
     * Copies every node and edge of {@code other} into this graph.
     *
     * @return this graph for chaining
     */
    public KinematicGraph merge(KinematicGraph other) {
        checkWritable();
        for (AxisNode node : other.nodes.values()) {
            addNode(node);
        }
        for (Map.Entry<String, String> edge : other.parents.entrySet()) {
            addEdge(edge.getValue(), edge.getKey());
        }
        return this;
    }

    /**
     * Finds the unique path of stage names from {@code root} to {@code target}.
     * Breadth-first, which on a tree with unit edge weights is the shortest path.
     *
     * @throws IllegalArgumentException if either node is unknown or target is not below root
     */
    public List<String> resolvePath(String root, String target) {
        requireNode(root);
        requireNode(target);

        Map<String, String> cameFrom = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root);
        cameFrom.put(root, null);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(target)) {
                List<String> path = new ArrayList<>();
                for (String step = target; step != null; step = cameFrom.get(step)) {
                    path.add(step);
                }
                Collections.reverse(path);
                return Collections.unmodifiableList(path);
            }
            for (String next : children.get(current)) {
                if (!cameFrom.containsKey(next)) {
                    cameFrom.put(next, current);
                    queue.add(next);
                }
            }
        }
        throw new IllegalArgumentException(String.format("No path from '%s' to '%s'", root, target));
    }

    public AxisNode getNode(String name) {
        return requireNode(name);
    }

    public boolean containsNode(String name) {
        return nodes.containsKey(name);
    }

    public Set<String> getNodeNames() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /**
     * @return the parent of a stage, or null for a root
     */
    public String getParent(String name) {
        requireNode(name);
        return parents.get(name);
    }

    public List<String> getChildren(String name) {
        requireNode(name);
        return Collections.unmodifiableList(children.get(name));
    }

    /**
     * Returns a frozen copy of this graph that rejects further changes.
     */
    public KinematicGraph unmodifiableCopy() {
        Map<String, List<String>> childCopy = new LinkedHashMap<>();
        children.forEach((k, v) -> childCopy.put(k, List.copyOf(v)));
        return new KinematicGraph(
                Collections.unmodifiableMap(new LinkedHashMap<>(nodes)),
                Collections.unmodifiableMap(childCopy),
                Map.copyOf(parents),
                true);
    }

    private AxisNode requireNode(String name) {
        AxisNode node = nodes.get(name);
        if (node == null) {
            throw new IllegalArgumentException("Unknown axis '" + name + "', known axes: " + nodes.keySet());
        }
        return node;
    }

    private void checkWritable() {
        if (readOnly) {
            throw new UnsupportedOperationException("Kinematic graph is read-only");
        }
    }

    @Override
    public String toString() {
        return "KinematicGraph" + parents;
    }
}
