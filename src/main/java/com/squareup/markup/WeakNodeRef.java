package com.squareup.markup;

import java.lang.ref.WeakReference;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * <p>
 *   A non-owning reference to a {@link Node}, for cross-references inside a tree
 *   (e.g., a repeated fragment pointing back to its first occurrence). A weak
 *   reference neither keeps its target alive nor creates an ownership edge, so it
 *   can never introduce a cycle into the tree.
 * </p>
 *
 * <p>
 *   The reference is a lookup rather than a handle: {@link #resolve()} walks up
 *   from the target through the tree it currently belongs to, and returns the
 *   target only if none of the nodes on that chain was detached from its parent
 *   after the reference was created. The staleness is subtree-wide: detaching,
 *   removing, replacing or moving the target, or any node above it, makes the
 *   reference resolve to empty, and it stays empty. A reference made to a fresh
 *   root follows the node into whatever tree it is later attached to.
 * </p>
 *
 * <p>
 *   A reference made with {@link #of(Node, Node)} only watches the chain up to a
 *   given ancestor: it goes stale when the target leaves that ancestor's subtree,
 *   but not when the ancestor itself is moved around.
 * </p>
 *
 * <p>
 *   Resolving never mutates the tree. It costs one step per ancestor of the target.
 * </p>
 *
 * @param <T> The payload type of the tree.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class WeakNodeRef<T> {

  /** The node we refer to. */
  private final WeakReference<Node<T>> target;
  /** The ancestor bounding the watched chain, or null to watch the whole chain. */
  private final @Nullable WeakReference<Node<T>> trackedRoot;
  /** The detachment clock at creation; later detachments on the chain invalidate us. */
  private final long createdAt;

  /**
   * Create a weak reference. Use {@link Node#weakRef()} or {@link #of(Node, Node)}.
   *
   * @param target The node we refer to.
   * @param trackedRoot The ancestor bounding the watched chain, or null for the whole
   *                    chain. If given, this must be the target or one of its ancestors.
   */
  WeakNodeRef(Node<T> target, @Nullable Node<T> trackedRoot) {
    this.target = new WeakReference<>(target);
    this.trackedRoot = trackedRoot == null ? null : new WeakReference<>(trackedRoot);
    this.createdAt = Node.detachClock();
  }

  /**
   * Create a weak reference watching the target only up to a given ancestor. The
   * reference then goes stale as soon as the target leaves that ancestor's subtree,
   * whatever happens to the ancestor itself.
   *
   * @param target The node to refer to.
   * @param trackedRoot The target itself or one of its ancestors.
   * @param <T> The payload type of the tree.
   *
   * @return A new weak reference.
   *
   * @throws IllegalArgumentException Thrown if the tracked root is not the target or
   *         one of its ancestors.
   */
  public static <T> WeakNodeRef<T> of(Node<T> target, Node<T> trackedRoot) {
    if (target != trackedRoot && !trackedRoot.isAncestorOf(target)) {
      throw new IllegalArgumentException(
          trackedRoot + " is not an ancestor of " + target);
    }
    return new WeakNodeRef<>(target, trackedRoot);
  }

  /**
   * Look up the target.
   *
   * @return The target, if neither it nor any watched node above it was detached
   *         since this reference was created; empty otherwise.
   */
  public Optional<Node<T>> resolve() {
    return Optional.ofNullable(resolveOrNull());
  }

  /**
   * @return True if this reference no longer resolves to its target.
   */
  public boolean isStale() {
    return resolveOrNull() == null;
  }

  /**
   * @see #resolve()
   */
  private @Nullable Node<T> resolveOrNull() {
    Node<T> node = target.get();
    if (node == null) {
      return null;
    }
    Node<T> bound = null;
    if (trackedRoot != null) {
      bound = trackedRoot.get();
      if (bound == null) {
        return null;
      }
    }
    for (Node<T> ancestor = node; ancestor != null; ancestor = ancestor.parent()) {
      if (ancestor == bound) {
        return node;
      }
      if (ancestor.detachedAt() > createdAt) {
        return null;
      }
    }
    // ran off the top of the tree: fine only if we were watching the whole chain
    return bound == null ? node : null;
  }

  /**
   * Check whether this reference refers to the given node, regardless of whether the
   * reference is stale.
   *
   * @param node The node to compare against.
   *
   * @return True if the given node is the target of this reference.
   */
  public boolean refersTo(Node<T> node) {
    return target.get() == node;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    Node<T> node = resolveOrNull();
    return node == null ? "WeakNodeRef[stale]" : "WeakNodeRef[" + node + "]";
  }
}
