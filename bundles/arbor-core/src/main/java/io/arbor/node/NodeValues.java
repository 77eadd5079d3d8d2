package io.arbor.node;

/**
 * Normalization of scalar payloads before they are written.
 */
public final class NodeValues {

  /**
   * Value stored for numbers the store cannot represent: integers outside the signed 64-bit
   * range, and floats which are not finite or overflow a double. The node keeps its numeric kind.
   */
  public static final String UNSUPPORTED_NUMERIC = "<unsupported numeric>";

  private NodeValues() {
    throw new AssertionError();
  }

  /**
   * Sanitize a raw scalar.
   *
   * @param kind scalar kind
   * @param raw raw textual value as produced by the source adapter
   * @return the value to store
   */
  public static String sanitize(final NodeKind kind, final String raw) {
    switch (kind) {
      case INTEGER:
        return isSupportedInteger(raw) ? raw : UNSUPPORTED_NUMERIC;
      case FLOAT:
        return isSupportedFloat(raw) ? raw : UNSUPPORTED_NUMERIC;
      default:
        return raw;
    }
  }

  public static boolean isSanitized(final String value) {
    return UNSUPPORTED_NUMERIC.equals(value);
  }

  private static boolean isSupportedInteger(final String raw) {
    try {
      Long.parseLong(raw);
      return true;
    } catch (final NumberFormatException e) {
      return false;
    }
  }

  private static boolean isSupportedFloat(final String raw) {
    try {
      return Double.isFinite(Double.parseDouble(raw));
    } catch (final NumberFormatException e) {
      return false;
    }
  }
}
