package com.lingchain.domain;

import java.util.Objects;

/**
 * One string reached during a chain search, linked back to the node it was derived from.
 *
 * <p>Nodes are immutable and only point from child to parent, so all nodes created by one search
 * form a tree rooted at the input word. Equality is identity: two nodes holding the same value
 * under different parents are distinct branches.
 */
public final class ChainNode {
  private final String value;
  private final ChainNode parent;
  private final int depth;

  private ChainNode(String value, ChainNode parent) {
    this.value = Objects.requireNonNull(value, "value");
    this.parent = parent;
    this.depth = parent == null ? 0 : parent.depth + 1;
  }

  /** Create the root of a new search tree. */
  public static ChainNode root(String value) {
    return new ChainNode(value, null);
  }

  /** Create a node one deletion below this one. */
  public ChainNode child(String value) {
    return new ChainNode(value, this);
  }

  public String value() {
    return value;
  }

  /** Parent node, or null for the root. */
  public ChainNode parent() {
    return parent;
  }

  public boolean isRoot() {
    return parent == null;
  }

  /** Number of deletions between the root and this node. */
  public int depth() {
    return depth;
  }

  @Override
  public String toString() {
    return "ChainNode[" + value + ", depth=" + depth + "]";
  }
}
