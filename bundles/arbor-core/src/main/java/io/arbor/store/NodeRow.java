package io.arbor.store;

import io.arbor.node.NodeKind;

/**
 * Decoded fixed-width row of the node table. String columns are references into the string heap.
 */
final class NodeRow {

  /** Reference of an absent string, used for the value of containers. */
  static final long NO_REF = -1L;

  final long parentId;

  final int rank;

  final NodeKind kind;

  final long keyRef;

  final long valueRef;

  final long pathRef;

  NodeRow(final long parentId, final int rank, final NodeKind kind, final long keyRef, final long valueRef,
      final long pathRef) {
    this.parentId = parentId;
    this.rank = rank;
    this.kind = kind;
    this.keyRef = keyRef;
    this.valueRef = valueRef;
    this.pathRef = pathRef;
  }

  boolean hasValue() {
    return valueRef != NO_REF;
  }
}
