package io.arbor.service.navigate;

import com.google.common.base.MoreObjects;
import io.arbor.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * One row of a navigator window.
 */
public final class ChildSummary {

  private final long id;

  private final String key;

  private final NodeKind kind;

  private final @Nullable String preview;

  private final long childCount;

  private final long rank;

  public ChildSummary(final long id, final String key, final NodeKind kind, final @Nullable String preview,
      final long childCount, final long rank) {
    this.id = id;
    this.key = requireNonNull(key);
    this.kind = requireNonNull(kind);
    this.preview = preview;
    this.childCount = childCount;
    this.rank = rank;
  }

  public long getId() {
    return id;
  }

  public String getKey() {
    return key;
  }

  public NodeKind getKind() {
    return kind;
  }

  /**
   * Truncated value of a scalar.
   *
   * @return the preview, {@code null} for containers and buckets
   */
  public @Nullable String getPreview() {
    return preview;
  }

  public long getChildCount() {
    return childCount;
  }

  public long getRank() {
    return rank;
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ChildSummary)) {
      return false;
    }
    final ChildSummary summary = (ChildSummary) other;
    return id == summary.id && childCount == summary.childCount && rank == summary.rank && kind == summary.kind
        && key.equals(summary.key) && Objects.equals(preview, summary.preview);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, key, kind, preview, childCount, rank);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", id)
                      .add("key", key)
                      .add("kind", kind)
                      .add("preview", preview)
                      .add("childCount", childCount)
                      .add("rank", rank)
                      .toString();
  }
}
