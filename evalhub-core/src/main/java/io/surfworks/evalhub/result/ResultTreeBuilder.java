package io.surfworks.evalhub.result;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link ResultTree} from nested maps without recursion.
 */
final class ResultTreeBuilder {

    private ResultTreeBuilder() {
    }

    static ResultTree build(Map<String, ?> source) {
        Objects.requireNonNull(source, "source cannot be null");

        List<Frame> preOrder = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(source, null, null));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            preOrder.add(frame);
            for (Map.Entry<?, ?> entry : frame.source.entrySet()) {
                String key = String.valueOf(entry.getKey());
                Object value = entry.getValue();
                if (value instanceof Map<?, ?> child) {
                    frame.children.put(key, null);
                    stack.push(new Frame(child, frame, key));
                } else if (value instanceof Number || value instanceof String || value instanceof Boolean) {
                    frame.metrics.put(key, value);
                }
            }
        }

        // Descendants follow their ancestor in pre-order, so walking backwards builds children first.
        // Child slots were reserved in source order, so put() keeps that order.
        ResultTree root = null;
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            Frame frame = preOrder.get(i);
            ResultTree node = frame.children.isEmpty()
                    ? new ResultTree.Leaf(frame.metrics)
                    : new ResultTree.Group(frame.metrics, frame.children);
            if (frame.parent == null) {
                root = node;
            } else {
                frame.parent.children.put(frame.name, node);
            }
        }
        return root;
    }

    private static final class Frame {
        private final Map<?, ?> source;
        private final Frame parent;
        private final String name;
        private final Map<String, Object> metrics = new LinkedHashMap<>();
        private final Map<String, ResultTree> children = new LinkedHashMap<>();

        Frame(Map<?, ?> source, Frame parent, String name) {
            this.source = source;
            this.parent = parent;
            this.name = name;
        }
    }
}
