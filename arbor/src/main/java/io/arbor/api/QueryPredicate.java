package io.arbor.api;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/** A compiled text predicate that filters the matches of a pattern. */
public sealed interface QueryPredicate
    permits QueryPredicate.CaptureEqCapture,
        QueryPredicate.CaptureEqString,
        QueryPredicate.CaptureMatchRegex {

  /** @return the capture whose text is tested */
  int captureId();

  /** {@code (eq? @a @b)}: both captures are present and their texts are byte-for-byte equal. */
  final class CaptureEqCapture implements QueryPredicate {
    private final int captureId;
    private final int otherCaptureId;

    public CaptureEqCapture(int captureId, int otherCaptureId) {
      this.captureId = captureId;
      this.otherCaptureId = otherCaptureId;
    }

    @Override
    public int captureId() {
      return captureId;
    }

    public int otherCaptureId() {
      return otherCaptureId;
    }

    @Override
    public String toString() {
      return "CaptureEqCapture{" + captureId + ", " + otherCaptureId + "}";
    }
  }

  /** {@code (eq? @a "text")}: the capture's text equals the literal's UTF-8 bytes. */
  final class CaptureEqString implements QueryPredicate {
    private final int captureId;
    private final String literal;
    private final ByteBuffer bytes;

    public CaptureEqString(int captureId, String literal) {
      this.captureId = captureId;
      this.literal = literal;
      this.bytes = ByteBuffer.wrap(literal.getBytes(StandardCharsets.UTF_8)).asReadOnlyBuffer();
    }

    @Override
    public int captureId() {
      return captureId;
    }

    public String literal() {
      return literal;
    }

    /** @return a read-only view of the literal's UTF-8 encoding */
    public ByteBuffer bytes() {
      return bytes.duplicate();
    }

    @Override
    public String toString() {
      return "CaptureEqString{" + captureId + ", \"" + literal + "\"}";
    }
  }

  /** {@code (match? @a "regex")}: the regex is found somewhere in the capture's text. */
  final class CaptureMatchRegex implements QueryPredicate {
    private final int captureId;
    private final Pattern regex;

    public CaptureMatchRegex(int captureId, Pattern regex) {
      this.captureId = captureId;
      this.regex = regex;
    }

    @Override
    public int captureId() {
      return captureId;
    }

    public Pattern regex() {
      return regex;
    }

    @Override
    public String toString() {
      return "CaptureMatchRegex{" + captureId + ", /" + regex.pattern() + "/}";
    }
  }
}
