package io.arbor.exception;

/**
 * Lookup of a node by id or by materialized path missed.
 */
public final class NodeNotFoundException extends ArborException {

  private static final long serialVersionUID = 1L;

  private NodeNotFoundException(final String message) {
    super(message);
  }

  public static NodeNotFoundException forId(final long id) {
    return new NodeNotFoundException("No node with id " + id);
  }

  public static NodeNotFoundException forPath(final String path) {
    return new NodeNotFoundException("No node with path " + path);
  }
}
