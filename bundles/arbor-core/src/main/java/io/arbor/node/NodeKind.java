package io.arbor.node;

import java.util.Locale;

/**
 * Kinds of nodes in the store. Every kind has a stable byte id which is written to the node table.
 */
public enum NodeKind {

  OBJECT((byte) 1, true),

  ARRAY((byte) 2, true),

  STRING((byte) 3, false),

  INTEGER((byte) 4, false),

  FLOAT((byte) 5, false),

  BOOLEAN((byte) 6, false),

  NULL((byte) 7, false),

  /** Synthetic container standing in for a contiguous rank range of a large parent. */
  BUCKET((byte) 8, true);

  private static final NodeKind[] BY_ID = new NodeKind[16];

  static {
    for (final NodeKind kind : values()) {
      BY_ID[kind.id] = kind;
    }
  }

  private final byte id;

  private final boolean container;

  NodeKind(final byte id, final boolean container) {
    this.id = id;
    this.container = container;
  }

  public byte getId() {
    return id;
  }

  /**
   * Kind of a stored byte id.
   *
   * @param id the id
   * @return the kind
   * @throws IllegalArgumentException if no kind has this id
   */
  public static NodeKind getKind(final byte id) {
    final NodeKind kind = id >= 0 && id < BY_ID.length ? BY_ID[id] : null;
    if (kind == null) {
      throw new IllegalArgumentException("Unknown node kind id " + id + ".");
    }
    return kind;
  }

  public boolean isContainer() {
    return container;
  }

  /**
   * Lower-case name as shown to users and written to configuration files.
   *
   * @return the kind name
   */
  public String getName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
