package com.squareup.markup;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   Builds a {@link Node} tree from a stream of open / close / leaf events, as a
 *   parser consuming a {@link TokenStream} would produce them. The builder keeps a
 *   cursor: {@link #push(Object)} adds a node under the cursor and moves the cursor
 *   into it, {@link #pop()} moves the cursor back to the parent, and
 *   {@link #append(Object)} adds a leaf without moving the cursor.
 * </p>
 *
 * <blockquote><pre>
 * TreeBuilder&lt;String&gt; b = new TreeBuilder&lt;&gt;("document");
 * try (TreeBuilder.Scope list = b.open("list")) {
 *   b.append("item 1");
 *   b.append("item 2");
 * }
 * Node&lt;String&gt; root = b.root();
 * </pre></blockquote>
 *
 * <p>
 *   An unbalanced {@link #pop()} at the root is ignored, mirroring how the lexer
 *   treats an unbalanced close.
 * </p>
 *
 * @param <T> The payload type of the tree.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class TreeBuilder<T> {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

  /**
   * A scope opened by {@link #open(Object)}. Closing it moves the cursor back to
   * where it was before the scope was opened, closing any scopes left open inside.
   */
  public final class Scope implements AutoCloseable {
    /** The depth of the cursor before this scope was opened. */
    private final int depth;
    /** The node this scope opened. */
    private final Node<T> node;

    private Scope(int depth, Node<T> node) {
      this.depth = depth;
      this.node = node;
    }

    /**
     * @return The node this scope opened.
     */
    public Node<T> node() {
      return node;
    }

    /** {@inheritDoc} */
    @Override public void close() {
      while (cursor.size() > depth) {
        cursor.remove(cursor.size() - 1);
      }
    }
  }

  /** The root of the tree being built. */
  private final Node<T> root;
  /** The path from the root to the current node, root first. Never empty. */
  private final List<Node<T>> cursor = new ArrayList<>();

  /**
   * Start building below an existing node.
   *
   * @param root The node that new nodes are added to at first.
   */
  public TreeBuilder(Node<T> root) {
    if (root == null) {
      throw new NullPointerException("Root may not be null");
    }
    this.root = root;
    this.cursor.add(root);
  }

  /**
   * Start building a new tree.
   *
   * @param rootPayload The payload of the root of the new tree.
   */
  public TreeBuilder(@Nullable T rootPayload) {
    this(new Node<>(rootPayload));
  }

  /**
   * Add a node as the last child of the current node and make it the current node.
   *
   * @param payload The payload of the new node.
   *
   * @return The new node.
   */
  public Node<T> push(@Nullable T payload) {
    Node<T> node = current().appendChild(payload);
    cursor.add(node);
    return node;
  }

  /**
   * Make the parent of the current node the current node. This is a noop if the
   * current node is the root.
   *
   * @return The node that was current before this call, or null if the cursor was
   *         already at the root.
   */
  public @Nullable Node<T> pop() {
    if (cursor.size() > 1) {
      return cursor.remove(cursor.size() - 1);
    } else {
      log.debug("[[Ignoring pop at the root of {}]]", root);
      return null;
    }
  }

  /**
   * Add a leaf as the last child of the current node, without moving the cursor.
   *
   * @param payload The payload of the new node.
   *
   * @return The new node.
   */
  public Node<T> append(@Nullable T payload) {
    return current().appendChild(payload);
  }

  /**
   * {@linkplain #push(Object) Push} a node, returning a scope that pops back to the
   * current node when closed. Use with try-with-resources.
   *
   * @param payload The payload of the new node.
   *
   * @return A scope for the new node.
   */
  public Scope open(@Nullable T payload) {
    int depth = cursor.size();
    return new Scope(depth, push(payload));
  }

  /**
   * @return The root of the tree being built.
   */
  public Node<T> root() {
    return root;
  }

  /**
   * @return The node new nodes are currently added to.
   */
  public Node<T> current() {
    return cursor.get(cursor.size() - 1);
  }

  /**
   * @return The number of pushes not yet popped.
   */
  public int depth() {
    return cursor.size() - 1;
  }
}
