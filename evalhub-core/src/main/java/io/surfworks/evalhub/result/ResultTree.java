package io.surfworks.evalhub.result;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Nested metric output of an evaluation tool: groups of tasks, subgroups, metrics.
 *
 * <p>A node is either a {@link Leaf} holding a metric bundle or a {@link Group} with
 * named children (and optionally its own metrics). There is no depth bound, so both
 * construction and flattening walk the tree with an explicit stack.
 */
public sealed interface ResultTree permits ResultTree.Leaf, ResultTree.Group {

    /** Separator between path segments in flattened metric keys */
    String SEPARATOR = "/";

    /**
     * Metrics attached directly to this node.
     */
    Map<String, Object> metrics();

    /**
     * A metric bundle with no children.
     */
    record Leaf(Map<String, Object> metrics) implements ResultTree {
        public Leaf {
            metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        }
    }

    /**
     * An internal node with named children.
     */
    record Group(Map<String, Object> metrics, Map<String, ResultTree> children) implements ResultTree {
        public Group {
            metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
            Objects.requireNonNull(children, "children cannot be null");
            children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        }
    }

    static ResultTree leaf(Map<String, Object> metrics) {
        return new Leaf(metrics);
    }

    static ResultTree group(Map<String, ResultTree> children) {
        return new Group(Map.of(), children);
    }

    /**
     * Builds a tree from plain nested maps (as decoded from JSON). Map values become
     * children; number, string and boolean values become metrics; anything else is dropped.
     */
    static ResultTree fromMap(Map<String, ?> source) {
        return ResultTreeBuilder.build(source);
    }

    /**
     * Flattens the tree into {@code group/child/metric} keys in depth-first order.
     */
    default Map<String, Object> flatten() {
        Map<String, Object> flat = new LinkedHashMap<>();
        Deque<Map.Entry<String, ResultTree>> stack = new ArrayDeque<>();
        stack.push(Map.entry("", this));
        while (!stack.isEmpty()) {
            Map.Entry<String, ResultTree> entry = stack.pop();
            String prefix = entry.getKey();
            ResultTree node = entry.getValue();
            for (Map.Entry<String, Object> metric : node.metrics().entrySet()) {
                flat.put(prefix + metric.getKey(), metric.getValue());
            }
            if (node instanceof Group group) {
                List<Map.Entry<String, ResultTree>> children = new ArrayList<>(group.children().entrySet());
                for (int i = children.size() - 1; i >= 0; i--) {
                    Map.Entry<String, ResultTree> child = children.get(i);
                    stack.push(Map.entry(prefix + child.getKey() + SEPARATOR, child.getValue()));
                }
            }
        }
        return flat;
    }
}
