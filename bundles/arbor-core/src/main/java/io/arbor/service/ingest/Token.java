package io.arbor.service.ingest;

import com.google.common.base.MoreObjects;
import io.arbor.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A token of the format independent stream the ingestion pipeline consumes.
 */
public final class Token {

  private static final Token START_OBJECT = new Token(TokenType.CONTAINER_START, NodeKind.OBJECT, null);

  private static final Token START_ARRAY = new Token(TokenType.CONTAINER_START, NodeKind.ARRAY, null);

  private static final Token END_OBJECT = new Token(TokenType.CONTAINER_END, NodeKind.OBJECT, null);

  private static final Token END_ARRAY = new Token(TokenType.CONTAINER_END, NodeKind.ARRAY, null);

  private final TokenType type;

  private final @Nullable NodeKind kind;

  private final @Nullable String text;

  private Token(final TokenType type, final @Nullable NodeKind kind, final @Nullable String text) {
    this.type = type;
    this.kind = kind;
    this.text = text;
  }

  public static Token startObject() {
    return START_OBJECT;
  }

  public static Token startArray() {
    return START_ARRAY;
  }

  public static Token endObject() {
    return END_OBJECT;
  }

  public static Token endArray() {
    return END_ARRAY;
  }

  public static Token key(final String key) {
    return new Token(TokenType.KEY, null, requireNonNull(key));
  }

  /**
   * A scalar.
   *
   * @param kind the scalar kind
   * @param text the textual value: the string itself, the number as written, {@code true},
   *        {@code false} or {@code null}
   * @return the token
   */
  public static Token scalar(final NodeKind kind, final String text) {
    checkArgument(!kind.isContainer(), "%s is no scalar kind", kind);
    return new Token(TokenType.SCALAR, kind, requireNonNull(text));
  }

  public TokenType getType() {
    return type;
  }

  /**
   * Kind of the container or scalar, {@code null} for keys.
   *
   * @return the kind
   */
  public @Nullable NodeKind getKind() {
    return kind;
  }

  /**
   * Key or scalar text, {@code null} for container tokens.
   *
   * @return the text
   */
  public @Nullable String getText() {
    return text;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("type", type).add("kind", kind).add("text", text).toString();
  }
}
