package com.squareup.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/**
 * <p>
 *   An element of a mutable, ordered tree. A node owns its children, in a
 *   meaningful order, and knows its parent. The tree maintains a single
 *   ownership invariant under every mutation: a node is a child of at most one
 *   parent, and {@link #parent()} always returns the node currently holding it
 *   as a child (or null for a root). Attaching a node somewhere detaches it from
 *   wherever it was before, and attaching a node below itself is rejected, so no
 *   ownership cycle can ever be built.
 * </p>
 *
 * <p>
 *   A node carries an opaque payload supplied by the caller; the tree never looks
 *   at it except to run caller-supplied predicates in {@link #find(Predicate)}.
 *   Nodes have identity semantics: two nodes with equal payloads are still
 *   different nodes.
 * </p>
 *
 * <p>
 *   Cross-references within a tree that must not own their target should use a
 *   {@link WeakNodeRef} from {@link #weakRef()}. Trees are not threadsafe; a tree
 *   must have a single writer at a time.
 * </p>
 *
 * @param <T> The type of the payload of the nodes in the tree.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class Node<T> {

  /**
   * A clock ticking once per detachment, across all trees. A {@link WeakNodeRef}
   * compares the ticks of the nodes above its target against its own creation tick.
   */
  private static final AtomicLong DETACH_CLOCK = new AtomicLong();

  /** The caller's value for this node. */
  private @Nullable T payload;
  /** The children of this node, in order. Every child's {@link #parent} is this node. */
  private final List<Node<T>> children = new ArrayList<>();
  /** The node holding this one as a child, or null if this is a root. */
  private @Nullable Node<T> parent = null;
  /** The {@link #DETACH_CLOCK} tick at which this node was last detached, or 0 if never. */
  private long detachedAt = 0L;

  /**
   * Create a new root node with no children.
   *
   * @param payload See {@link #payload}.
   */
  public Node(@Nullable T payload) {
    this.payload = payload;
  }

  /**
   * @see #Node(Object)
   */
  public static <T> Node<T> of(@Nullable T payload) {
    return new Node<>(payload);
  }

  /**
   * @return The payload of this node.
   */
  public @Nullable T payload() {
    return payload;
  }

  /**
   * @param payload The new payload of this node.
   */
  public void setPayload(@Nullable T payload) {
    this.payload = payload;
  }

  // --------------------------------------------------------------------------
  // Ancestry
  // --------------------------------------------------------------------------

  /**
   * @return The parent of this node, or null if this node is a root.
   */
  public @Nullable Node<T> parent() {
    return parent;
  }

  /**
   * @return True if this node has no parent.
   */
  public boolean isRoot() {
    return parent == null;
  }

  /**
   * @return The root of the tree this node is in; this node itself if it is a root.
   */
  public Node<T> root() {
    Node<T> node = this;
    while (node.parent != null) {
      node = node.parent;
    }
    return node;
  }

  /**
   * @return The number of ancestors of this node. A root has depth 0.
   */
  public int depth() {
    int depth = 0;
    for (Node<T> node = parent; node != null; node = node.parent) {
      depth += 1;
    }
    return depth;
  }

  /**
   * @return The ancestors of this node, nearest first. This is a snapshot.
   */
  public List<Node<T>> ancestors() {
    List<Node<T>> ancestors = new ArrayList<>();
    for (Node<T> node = parent; node != null; node = node.parent) {
      ancestors.add(node);
    }
    return ancestors;
  }

  /**
   * @return The nodes from the root of this tree down to and including this node.
   *         This is a snapshot.
   */
  public List<Node<T>> path() {
    List<Node<T>> path = ancestors();
    Collections.reverse(path);
    path.add(this);
    return path;
  }

  /**
   * @param other The node to check.
   *
   * @return True if this node is a strict ancestor of the other node.
   */
  public boolean isAncestorOf(Node<T> other) {
    for (Node<T> node = other.parent; node != null; node = node.parent) {
      if (node == this) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return The tick at which this node was last detached from a parent, or 0.
   */
  long detachedAt() {
    return detachedAt;
  }

  /**
   * @return The current tick of the detachment clock.
   */
  static long detachClock() {
    return DETACH_CLOCK.get();
  }

  /**
   * Clear the parent of this node, which its parent must already have dropped
   * from its children, and stamp the detachment.
   */
  private void unlink() {
    parent = null;
    detachedAt = DETACH_CLOCK.incrementAndGet();
  }

  // --------------------------------------------------------------------------
  // Children
  // --------------------------------------------------------------------------

  /**
   * <p>
   *   The children of this node, in order. This is a live, read-only view: every
   *   new iteration reflects the children at the time it starts. Mutating this
   *   node while iterating over the view throws a
   *   {@link java.util.ConcurrentModificationException}.
   * </p>
   *
   * @return A read-only view of the children of this node.
   */
  public List<Node<T>> children() {
    return Collections.unmodifiableList(children);
  }

  /**
   * @return The number of children of this node.
   */
  public int childCount() {
    return children.size();
  }

  /**
   * @return True if this node has at least one child.
   */
  public boolean hasChildren() {
    return !children.isEmpty();
  }

  /**
   * @param index The index of the child.
   *
   * @return The child at the given index.
   *
   * @throws IndexOutOfBoundsException Thrown if there is no child at that index.
   */
  public Node<T> child(int index) throws IndexOutOfBoundsException {
    return children.get(index);
  }

  /**
   * @return The first child of this node, or null if it has none.
   */
  public @Nullable Node<T> firstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  /**
   * @return The last child of this node, or null if it has none.
   */
  public @Nullable Node<T> lastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  /**
   * @return The index of this node in its parent's children, or -1 for a root.
   */
  public int index() {
    return parent == null ? -1 : parent.indexOfChild(this);
  }

  /**
   * @return The sibling following this node, or null if there is none.
   */
  public @Nullable Node<T> nextSibling() {
    if (parent == null) {
      return null;
    }
    int index = parent.indexOfChild(this) + 1;
    return index < parent.children.size() ? parent.children.get(index) : null;
  }

  /**
   * @return The sibling preceding this node, or null if there is none.
   */
  public @Nullable Node<T> previousSibling() {
    if (parent == null) {
      return null;
    }
    int index = parent.indexOfChild(this) - 1;
    return index >= 0 ? parent.children.get(index) : null;
  }

  /**
   * Find a child by identity.
   */
  private int indexOfChild(Node<T> child) {
    for (int i = 0; i < children.size(); ++i) {
      if (children.get(i) == child) {
        return i;
      }
    }
    throw new IllegalStateException("Node is not a child of its parent: " + child);
  }

  // --------------------------------------------------------------------------
  // Mutation
  // --------------------------------------------------------------------------

  /**
   * <p>
   *   Attach a node as a child of this node at the given index. If the node is
   *   currently attached anywhere (including to this node), it is first detached,
   *   and the index is interpreted against the children as they are after that
   *   detachment. Moving a node this way counts as detaching it, so weak
   *   references into the moved subtree go stale.
   * </p>
   *
   * @param index The index the child will have, between 0 and the number of
   *              children (after detaching the child), inclusive.
   * @param child The node to attach.
   *
   * @return This node.
   *
   * @throws IllegalArgumentException Thrown if the child is this node or one of its
   *         ancestors, since attaching it would create a cycle.
   * @throws IndexOutOfBoundsException Thrown if the index is out of range. The tree
   *         is left unchanged in this case.
   */
  public Node<T> insert(int index, Node<T> child) {
    if (child == null) {
      throw new NullPointerException("Child may not be null");
    }
    if (child == this || child.isAncestorOf(this)) {
      throw new IllegalArgumentException(
          "Cannot attach " + child + " below itself (under " + this + ")");
    }
    int size = child.parent == this ? children.size() - 1 : children.size();
    if (index < 0 || index > size) {
      throw new IndexOutOfBoundsException("Index " + index + " out of range [0, " + size + "]");
    }
    child.detach();
    children.add(index, child);
    child.parent = this;
    return this;
  }

  /**
   * Attach a node as the last child of this node.
   *
   * @see #insert(int, Node)
   */
  public Node<T> append(Node<T> child) {
    int size = child != null && child.parent == this ? children.size() - 1 : children.size();
    return insert(size, child);
  }

  /**
   * Attach a node as the first child of this node.
   *
   * @see #insert(int, Node)
   */
  public Node<T> prepend(Node<T> child) {
    return insert(0, child);
  }

  /**
   * Create a node with the given payload and attach it as the last child of this node.
   *
   * @param payload The payload of the new child.
   *
   * @return The new child.
   */
  public Node<T> appendChild(@Nullable T payload) {
    Node<T> child = new Node<>(payload);
    append(child);
    return child;
  }

  /**
   * Detach this node from its parent. The node keeps its whole subtree and can be
   * attached elsewhere. Every {@link WeakNodeRef} to this node or to any of its
   * descendants that exists at this point goes stale, and stays stale even if the
   * node is attached again.
   * Detaching a root is a noop.
   *
   * @return This node.
   */
  public Node<T> detach() {
    if (parent != null) {
      parent.children.remove(parent.indexOfChild(this));
      unlink();
    }
    return this;
  }

  /**
   * Detach the child at the given index.
   *
   * @param index The index of the child to detach.
   *
   * @return The detached child.
   *
   * @throws IndexOutOfBoundsException Thrown if there is no child at that index.
   */
  public Node<T> removeChild(int index) throws IndexOutOfBoundsException {
    Node<T> child = children.remove(index);
    child.unlink();
    return child;
  }

  /**
   * Detach every child of this node.
   *
   * @return The detached children, in their former order.
   */
  public List<Node<T>> clear() {
    List<Node<T>> removed = new ArrayList<>(children);
    for (Node<T> child : removed) {
      child.unlink();
    }
    children.clear();
    return removed;
  }

  /**
   * <p>
   *   Put another node in this node's place: same parent, same index. The
   *   replacement is first detached from wherever it was, and this node ends up a
   *   detached root (with its subtree intact). The swap is a single write to the
   *   parent's child list, so no reader can observe the parent without either node.
   * </p>
   *
   * <p>
   *   The replacement may be a descendant of this node, but not an ancestor.
   *   Replacing a node with itself is a noop.
   * </p>
   *
   * @param replacement The node to put in this node's place.
   *
   * @return This node, now detached.
   *
   * @throws IllegalStateException Thrown if this node is a root, and therefore has
   *         no place to put the replacement in.
   * @throws IllegalArgumentException Thrown if the replacement is an ancestor of this node.
   */
  public Node<T> replaceWith(Node<T> replacement) {
    if (replacement == null) {
      throw new NullPointerException("Replacement may not be null");
    }
    if (replacement == this) {
      return this;
    }
    if (parent == null) {
      throw new IllegalStateException("Cannot replace a root node: " + this);
    }
    if (replacement.isAncestorOf(this)) {
      throw new IllegalArgumentException(
          "Cannot replace " + this + " with its ancestor " + replacement);
    }
    replacement.detach();
    Node<T> owner = parent;
    owner.children.set(owner.indexOfChild(this), replacement);
    replacement.parent = owner;
    unlink();
    return this;
  }

  /**
   * @return A new weak reference to this node. It goes stale as soon as this node,
   *         or any node above it, is detached from its parent.
   *
   * @see WeakNodeRef
   */
  public WeakNodeRef<T> weakRef() {
    return new WeakNodeRef<>(this, null);
  }

  // --------------------------------------------------------------------------
  // Traversal
  // --------------------------------------------------------------------------

  /**
   * @param traversal The order to visit nodes in.
   *
   * @return This node and all of its descendants, lazily, in the given order. Every
   *         iteration walks the tree as it is when the iteration starts; the tree must
   *         not be mutated during an iteration.
   */
  public Iterable<Node<T>> descendants(Traversal traversal) {
    return () -> traversal.iterator(this);
  }

  /**
   * @return This node and all of its descendants, in {@linkplain Traversal#PRE_ORDER pre-order}.
   */
  public Iterable<Node<T>> descendants() {
    return descendants(Traversal.DEFAULT);
  }

  /**
   * Find all nodes in this subtree (including this node) whose payload matches a
   * predicate.
   *
   * @param predicate The predicate over payloads.
   * @param traversal The order in which to visit nodes.
   *
   * @return A lazy iterable over the matching nodes, in traversal order.
   */
  public Iterable<Node<T>> find(Predicate<? super T> predicate, Traversal traversal) {
    return () -> new FilteringIterator<>(traversal.iterator(this), predicate);
  }

  /**
   * @see #find(Predicate, Traversal)
   */
  public Iterable<Node<T>> find(Predicate<? super T> predicate) {
    return find(predicate, Traversal.DEFAULT);
  }

  /**
   * Find the first node in this subtree (including this node) whose payload matches a
   * predicate. The search stops at the first match.
   *
   * @param predicate The predicate over payloads.
   * @param traversal The order in which to visit nodes.
   *
   * @return The first matching node, if any.
   */
  public Optional<Node<T>> findFirst(Predicate<? super T> predicate, Traversal traversal) {
    Iterator<Node<T>> iter = find(predicate, traversal).iterator();
    return iter.hasNext() ? Optional.of(iter.next()) : Optional.empty();
  }

  /**
   * @see #findFirst(Predicate, Traversal)
   */
  public Optional<Node<T>> findFirst(Predicate<? super T> predicate) {
    return findFirst(predicate, Traversal.DEFAULT);
  }

  // --------------------------------------------------------------------------
  // Utilities
  // --------------------------------------------------------------------------

  /**
   * @return A deep copy of the subtree rooted at this node, as a new detached root.
   *         Payloads are shared, not copied.
   */
  public Node<T> copy() {
    Node<T> copy = new Node<>(payload);
    for (Node<T> child : children) {
      Node<T> childCopy = child.copy();
      copy.children.add(childCopy);
      childCopy.parent = copy;
    }
    return copy;
  }

  /**
   * Render the subtree rooted at this node, one node per line, indented by two
   * spaces per level. Useful for debugging and for tests.
   *
   * @return A multi-line rendering of this subtree, without a trailing newline.
   */
  public String dump() {
    StringBuilder b = new StringBuilder();
    int baseDepth = depth();
    for (Node<T> node : descendants(Traversal.PRE_ORDER)) {
      if (b.length() > 0) {
        b.append('\n');
      }
      for (int i = node.depth() - baseDepth; i > 0; --i) {
        b.append("  ");
      }
      b.append(node.payload);
    }
    return b.toString();
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "Node[" + payload + "; " + children.size() + " children]";
  }

  /**
   * An iterator over nodes passing a predicate over their payloads.
   */
  private static class FilteringIterator<T> implements Iterator<Node<T>> {
    private final Iterator<Node<T>> source;
    private final Predicate<? super T> predicate;
    private @Nullable Node<T> next = null;

    FilteringIterator(Iterator<Node<T>> source, Predicate<? super T> predicate) {
      this.source = source;
      this.predicate = predicate;
    }

    /** {@inheritDoc} */
    @Override public boolean hasNext() {
      while (next == null && source.hasNext()) {
        Node<T> candidate = source.next();
        if (predicate.test(candidate.payload)) {
          next = candidate;
        }
      }
      return next != null;
    }

    /** {@inheritDoc} */
    @Override public Node<T> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Node<T> rtn = next;
      next = null;
      return rtn;
    }
  }
}
