package io.arbor.service.path;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * One step of a path expression.
 */
public final class PathSegment {

  /** Kinds of steps. */
  public enum Type {
    /** Object member by key, {@code .key} or {@code ["key"]}. */
    KEY,

    /** Array element by index, {@code [i]}; negative indexes count from the end. */
    INDEX,

    /** Array slice {@code [start:end]}, recognized but not resolvable. */
    SLICE
  }

  private final Type type;

  private final String key;

  private final long index;

  /** The segment as written in the expression. */
  private final String source;

  private PathSegment(final Type type, final String key, final long index, final String source) {
    this.type = requireNonNull(type);
    this.key = requireNonNull(key);
    this.index = index;
    this.source = requireNonNull(source);
  }

  static PathSegment key(final String key, final String source) {
    return new PathSegment(Type.KEY, key, 0, source);
  }

  static PathSegment index(final long index, final String source) {
    return new PathSegment(Type.INDEX, "", index, source);
  }

  static PathSegment slice(final String source) {
    return new PathSegment(Type.SLICE, "", 0, source);
  }

  public Type getType() {
    return type;
  }

  public String getKey() {
    return key;
  }

  public long getIndex() {
    return index;
  }

  public String getSource() {
    return source;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("type", type).add("source", source).toString();
  }
}
