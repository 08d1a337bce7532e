package io.arbor.api;

import io.arbor.tree.Node;
import java.nio.ByteBuffer;

/**
 * Supplies the text of a node for predicate evaluation.
 *
 * <p>Decouples predicates from the buffer the tree was parsed from, so an edited or overlaid
 * buffer can be used. Implementations should return a view rather than a copy.
 */
@FunctionalInterface
public interface NodeTextProvider {

  /**
   * @param node the node
   * @return the bytes of the node's text, or {@code null} if there is none; the caller does not
   *     modify the buffer. Predicates over a node without text do not hold.
   */
  ByteBuffer text(Node node);

  /**
   * Reads node text from a source buffer by byte range.
   *
   * @param source the buffer the tree was parsed from
   * @return a provider returning read-only slices of {@code source}, and {@code null} for nodes
   *     whose span is not inside it
   */
  static NodeTextProvider of(byte[] source) {
    ByteBuffer buffer = ByteBuffer.wrap(source).asReadOnlyBuffer();
    return node -> {
      int start = node.startByte();
      int end = node.endByte();
      if (start < 0 || end > source.length || start > end) {
        return null;
      }
      return buffer.duplicate().limit(end).position(start).slice();
    };
  }
}
