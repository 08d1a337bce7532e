package io.arbor.internal_api;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 decoder for node text.
 *
 * <p>Malformed input yields {@code null} instead of replacement characters, so callers can treat
 * undecodable text as "does not match". Not thread-safe; each cursor owns its own instance.
 */
public final class Utf8Decoder {
  private final CharsetDecoder decoder =
      StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT);

  /**
   * Decodes the remaining bytes of {@code bytes} without moving its position.
   *
   * @param bytes the text
   * @return the decoded text or {@code null} if it is not valid UTF-8
   */
  public CharSequence decode(ByteBuffer bytes) {
    try {
      return decoder.decode(bytes.duplicate());
    } catch (CharacterCodingException e) {
      return null;
    }
  }

  /**
   * Decodes {@code source[start, end)}.
   *
   * @param source the source buffer
   * @param start the first byte
   * @param end the byte past the last one
   * @return the decoded text or {@code null} if the range is out of bounds or not valid UTF-8
   */
  public CharSequence decode(byte[] source, int start, int end) {
    if (start < 0 || end > source.length || start > end) {
      return null;
    }
    return decode(ByteBuffer.wrap(source, start, end - start));
  }
}
