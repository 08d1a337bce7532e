package io.arbor.impl;

import io.arbor.api.NodeTextProvider;
import io.arbor.api.Query;
import io.arbor.api.QueryPredicate;
import io.arbor.internal_api.Utf8Decoder;
import io.arbor.tree.Node;
import io.arbor.tree.query.RawCapture;
import io.arbor.tree.query.RawMatch;
import java.nio.ByteBuffer;

/**
 * Evaluates a query's predicates against the captures of a raw match.
 *
 * <p>A predicate over a capture the match does not contain is false, and so is one over a node the
 * text provider has no text for. Text that is not valid UTF-8 never matches a regex.
 */
final class MatchConditions {
  private final Query query;
  private final NodeTextProvider text;
  private final Utf8Decoder decoder = new Utf8Decoder();

  MatchConditions(Query query, NodeTextProvider text) {
    this.query = query;
    this.text = text;
  }

  boolean satisfies(RawMatch match) {
    for (QueryPredicate predicate : query.predicates(match.patternIndex())) {
      if (!test(predicate, match)) {
        return false;
      }
    }
    return true;
  }

  private boolean test(QueryPredicate predicate, RawMatch match) {
    Node node = captureForId(match, predicate.captureId());
    if (node == null) {
      return false;
    }
    if (predicate instanceof QueryPredicate.CaptureEqCapture eqCapture) {
      Node other = captureForId(match, eqCapture.otherCaptureId());
      if (other == null) {
        return false;
      }
      ByteBuffer bytes = text.text(node);
      return bytes != null && bytes.equals(text.text(other));
    }
    if (predicate instanceof QueryPredicate.CaptureEqString eqString) {
      ByteBuffer bytes = text.text(node);
      return bytes != null && bytes.equals(eqString.bytes());
    }
    if (predicate instanceof QueryPredicate.CaptureMatchRegex matchRegex) {
      ByteBuffer bytes = text.text(node);
      CharSequence chars = bytes != null ? decoder.decode(bytes) : null;
      return chars != null && matchRegex.regex().matcher(chars).find();
    }
    throw new IllegalStateException("Unsupported predicate: " + predicate);
  }

  private static Node captureForId(RawMatch match, int captureId) {
    for (RawCapture capture : match.captures()) {
      if (capture.index() == captureId) {
        return capture.node();
      }
    }
    return null;
  }
}
