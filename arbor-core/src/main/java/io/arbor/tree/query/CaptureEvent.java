package io.arbor.tree.query;

/** A single capture reported by {@link MatchSource#nextCapture()}, with the match that owns it. */
public final class CaptureEvent {
  private final RawMatch match;
  private final int position;

  /**
   * @param match the owning match
   * @param position the position of the capture within {@link RawMatch#captures()}
   */
  public CaptureEvent(RawMatch match, int position) {
    if (position < 0 || position >= match.captures().size()) {
      throw new IndexOutOfBoundsException(
          "Capture position " + position + " out of range for " + match);
    }
    this.match = match;
    this.position = position;
  }

  public RawMatch match() {
    return match;
  }

  public int position() {
    return position;
  }

  public RawCapture capture() {
    return match.captures().get(position);
  }
}
