package io.github.eutro.flowssa.core.util;

import io.github.eutro.flowssa.core.cfg.ControlFlowGraph;

import java.util.*;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 * <p>
 * Both walks use explicit stacks, so arbitrarily deep graphs can be walked.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The root of the walk.
     */
    final T root;
    /**
     * The successor function.
     */
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the block identifiers of a control flow graph, rooted at its entry.
     * Successors are visited in the order of their terminator's targets.
     *
     * @param cfg The graph.
     * @return The graph walker.
     */
    public static GraphWalker<Integer> blockWalker(ControlFlowGraph cfg) {
        return new GraphWalker<>(cfg.getEntryId(), cfg::successors);
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get a pre-order traversal of the graph. Every reachable node is visited exactly once,
     * but later children of a node are visited first.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the depth-first post-order of the graph, children visited in order.
     * <p>
     * A node is only yielded once all of its depth-first tree descendants have been,
     * so reversing this order gives a reverse post-order in which every edge that is
     * not a retreating edge goes forwards.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        private final Deque<T> nodes = new ArrayDeque<>();
        private final Deque<Iterator<? extends T>> pending = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            enter(root);
        }

        private void enter(T node) {
            seen.add(node);
            nodes.push(node);
            pending.push(getChildren.apply(node).iterator());
        }

        @Override
        public boolean hasNext() {
            return !nodes.isEmpty();
        }

        @Override
        public T next() {
            if (nodes.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Iterator<? extends T> children = pending.peek();
                T child = null;
                while (children.hasNext()) {
                    T next = children.next();
                    if (!seen.contains(next)) {
                        child = next;
                        break;
                    }
                }
                if (child == null) {
                    pending.pop();
                    return nodes.pop();
                }
                enter(child);
            }
        }
    }
}
