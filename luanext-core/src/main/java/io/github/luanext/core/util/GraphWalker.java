package io.github.luanext.core.util;

import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Function;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 * <p>
 * Children are visited in the order the successor function yields them,
 * and every node reachable from the root is yielded exactly once.
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
    final Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
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

    /**
     * Get the post-order traversal of the graph.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    /**
     * Get the reverse of the post-order traversal of the graph, in which the root comes first
     * and, ignoring back-edges, every node comes before its successors.
     *
     * @return The reverse post-order, as a new list.
     */
    public List<T> reversePostOrder() {
        List<T> ls = postOrder().toList();
        Collections.reverse(ls);
        return ls;
    }

    private class PreIter implements Iterator<T> {
        private final Deque<Iterator<? extends T>> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();
        @Nullable
        private T next;

        PreIter() {
            next = root;
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            while (!stack.isEmpty()) {
                Iterator<? extends T> top = stack.peek();
                if (!top.hasNext()) {
                    stack.pop();
                    continue;
                }
                T child = top.next();
                if (seen.add(child)) {
                    next = child;
                    return true;
                }
            }
            return false;
        }

        @Override
        public T next() {
            if (!hasNext()) throw new NoSuchElementException();
            T top = next;
            next = null;
            stack.push(getChildren.apply(top).iterator());
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        private final Deque<Frame<T>> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        PostIter() {
            push(root);
        }

        private void push(T node) {
            seen.add(node);
            Iterator<? extends T> children = getChildren.apply(node).iterator();
            stack.push(new Frame<>(node, children));
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Frame<T> top = stack.peek();
                if (top.children.hasNext()) {
                    T child = top.children.next();
                    if (!seen.contains(child)) {
                        push(child);
                    }
                } else {
                    stack.pop();
                    return top.node;
                }
            }
        }
    }

    private static final class Frame<T> {
        final T node;
        final Iterator<? extends T> children;

        Frame(T node, Iterator<? extends T> children) {
            this.node = node;
            this.children = children;
        }
    }
}
