package io.github.eutro.phpir.util;

import io.github.eutro.phpir.bound.BoundBlock;
import io.github.eutro.phpir.bound.ControlFlowGraph;

import java.util.*;

/**
 * A class for walking a graph depth-first, visiting each node once.
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
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over {@link BoundBlock}s, following every edge.
     *
     * @param root The root block.
     * @return The graph walker.
     */
    public static GraphWalker<BoundBlock> blockWalker(BoundBlock root) {
        return new GraphWalker<>(root, $ -> $.getEdge().targets);
    }

    /**
     * Create a graph walker over the blocks of a {@link ControlFlowGraph} reachable from its start.
     *
     * @param cfg The graph.
     * @return The graph walker.
     */
    public static GraphWalker<BoundBlock> blockWalker(ControlFlowGraph cfg) {
        return blockWalker(cfg.start());
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
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
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
}
