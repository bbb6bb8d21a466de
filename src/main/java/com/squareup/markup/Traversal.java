package com.squareup.markup;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * <p>
 *   The order in which {@link Node#descendants(Traversal)} and
 *   {@link Node#find(java.util.function.Predicate, Traversal)} visit a subtree.
 *   Every order includes the node the walk starts from, visits children in their
 *   list order, and is fully deterministic. For the tree
 * </p>
 *
 * <pre>
 *   a
 *     b
 *       d
 *     c
 * </pre>
 *
 * <ul>
 *   <li>{@link #PRE_ORDER} visits a, b, d, c;</li>
 *   <li>{@link #POST_ORDER} visits d, b, c, a; and</li>
 *   <li>{@link #BREADTH_FIRST} visits a, b, c, d.</li>
 * </ul>
 *
 * <p>
 *   All iterators are lazy and use an explicit stack or queue, so arbitrarily deep
 *   trees can be walked without overflowing the call stack.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public enum Traversal {

  /** Depth-first, each node before its children. */
  PRE_ORDER {
    /** {@inheritDoc} */
    @Override <T> Iterator<Node<T>> iterator(Node<T> start) {
      return new PreOrderIterator<>(start);
    }
  },

  /** Depth-first, each node after its children. */
  POST_ORDER {
    /** {@inheritDoc} */
    @Override <T> Iterator<Node<T>> iterator(Node<T> start) {
      return new PostOrderIterator<>(start);
    }
  },

  /** Level by level, top down. */
  BREADTH_FIRST {
    /** {@inheritDoc} */
    @Override <T> Iterator<Node<T>> iterator(Node<T> start) {
      return new BreadthFirstIterator<>(start);
    }
  };

  /** The traversal used when none is given. */
  public static final Traversal DEFAULT = PRE_ORDER;

  /**
   * Start a new walk.
   *
   * @param start The root of the subtree to walk.
   * @param <T> The payload type of the tree.
   *
   * @return A lazy iterator over the subtree.
   */
  abstract <T> Iterator<Node<T>> iterator(Node<T> start);

  /**
   * Pre-order: a stack of nodes still to visit, with children pushed in reverse.
   */
  private static class PreOrderIterator<T> implements Iterator<Node<T>> {
    private final Deque<Node<T>> stack = new ArrayDeque<>();

    PreOrderIterator(Node<T> start) {
      stack.push(start);
    }

    /** {@inheritDoc} */
    @Override public boolean hasNext() {
      return !stack.isEmpty();
    }

    /** {@inheritDoc} */
    @Override public Node<T> next() {
      if (stack.isEmpty()) {
        throw new NoSuchElementException();
      }
      Node<T> node = stack.pop();
      List<Node<T>> children = node.children();
      for (int i = children.size() - 1; i >= 0; --i) {
        stack.push(children.get(i));
      }
      return node;
    }
  }

  /**
   * Post-order: a stack of frames, each a node and the index of the next child
   * of it to descend into.
   */
  private static class PostOrderIterator<T> implements Iterator<Node<T>> {
    private final Deque<Node<T>> nodes = new ArrayDeque<>();
    private final Deque<Integer> nextChild = new ArrayDeque<>();

    PostOrderIterator(Node<T> start) {
      nodes.push(start);
      nextChild.push(0);
    }

    /** {@inheritDoc} */
    @Override public boolean hasNext() {
      return !nodes.isEmpty();
    }

    /** {@inheritDoc} */
    @Override public Node<T> next() {
      if (nodes.isEmpty()) {
        throw new NoSuchElementException();
      }
      while (true) {
        Node<T> node = nodes.peek();
        int index = nextChild.peek();
        if (index < node.childCount()) {
          nextChild.pop();
          nextChild.push(index + 1);
          nodes.push(node.child(index));
          nextChild.push(0);
        } else {
          nodes.pop();
          nextChild.pop();
          return node;
        }
      }
    }
  }

  /**
   * Breadth-first: a queue of nodes still to visit.
   */
  private static class BreadthFirstIterator<T> implements Iterator<Node<T>> {
    private final Deque<Node<T>> queue = new ArrayDeque<>();

    BreadthFirstIterator(Node<T> start) {
      queue.add(start);
    }

    /** {@inheritDoc} */
    @Override public boolean hasNext() {
      return !queue.isEmpty();
    }

    /** {@inheritDoc} */
    @Override public Node<T> next() {
      if (queue.isEmpty()) {
        throw new NoSuchElementException();
      }
      Node<T> node = queue.poll();
      queue.addAll(node.children());
      return node;
    }
  }
}
