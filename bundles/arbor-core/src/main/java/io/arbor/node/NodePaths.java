package io.arbor.node;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import io.arbor.settings.Fixed;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Construction of materialized paths. A child's path only depends on the parent's path, the
 * parent's kind and the child's key, so it is computed once when the row is written.
 *
 * <p>Object members with identifier-like keys are written as {@code .key}, all other keys as a
 * quoted JSON string in brackets ({@code ["us-east-1"]}), array elements as {@code [index]}.
 */
public final class NodePaths {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private NodePaths() {
    throw new AssertionError();
  }

  /**
   * Path of a child node.
   *
   * @param parentPath materialized path of the parent
   * @param parentKind kind of the parent, {@link NodeKind#OBJECT} or {@link NodeKind#ARRAY}
   * @param key the child's key (the decimal index for array elements)
   * @return the child's path
   */
  public static String childPath(final String parentPath, final NodeKind parentKind, final String key) {
    requireNonNull(parentPath);
    final String base = Fixed.ROOT_PATH.equals(parentPath) ? "" : parentPath;
    final String segment = segment(parentKind, key);
    if (base.isEmpty() && segment.charAt(0) == '[') {
      return Fixed.ROOT_PATH + segment;
    }
    return base + segment;
  }

  /**
   * The path segment a child contributes below its parent.
   *
   * @param parentKind kind of the parent
   * @param key the child's key
   * @return the segment, starting with {@code .} or {@code [}
   */
  public static String segment(final NodeKind parentKind, final String key) {
    requireNonNull(key);
    switch (parentKind) {
      case ARRAY:
        return "[" + key + "]";
      case OBJECT:
        if (isIdentifier(key)) {
          return "." + key;
        }
        return "[" + quote(key) + "]";
      default:
        throw new IllegalArgumentException("Nodes of kind " + parentKind + " have no children: " + key);
    }
  }

  public static boolean isIdentifier(final String key) {
    return IDENTIFIER.matcher(key).matches();
  }

  /**
   * Quote a key as a JSON string literal.
   *
   * @param key the key
   * @return the quoted key, including the surrounding quotes
   */
  public static String quote(final String key) {
    return '"' + new String(JsonStringEncoder.getInstance().quoteAsString(key)) + '"';
  }
}
