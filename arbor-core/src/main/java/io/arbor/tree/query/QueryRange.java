package io.arbor.tree.query;

import io.arbor.tree.Point;

/** Restricts a query execution to nodes intersecting a byte range and a point range. */
public final class QueryRange {
  public static final QueryRange ALL =
      new QueryRange(0, Integer.MAX_VALUE, Point.ZERO, Point.MAX);

  private final int startByte;
  private final int endByte;
  private final Point startPoint;
  private final Point endPoint;

  private QueryRange(int startByte, int endByte, Point startPoint, Point endPoint) {
    this.startByte = startByte;
    this.endByte = endByte;
    this.startPoint = startPoint;
    this.endPoint = endPoint;
  }

  public QueryRange withByteRange(int start, int end) {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid byte range [" + start + ", " + end + ")");
    }
    return new QueryRange(start, end, startPoint, endPoint);
  }

  public QueryRange withPointRange(Point start, Point end) {
    if (end.compareTo(start) < 0) {
      throw new IllegalArgumentException("Invalid point range [" + start + ", " + end + ")");
    }
    return new QueryRange(startByte, endByte, start, end);
  }

  public int startByte() {
    return startByte;
  }

  public int endByte() {
    return endByte;
  }

  public Point startPoint() {
    return startPoint;
  }

  public Point endPoint() {
    return endPoint;
  }

  @Override
  public String toString() {
    return "QueryRange{bytes=[" + startByte + ", " + endByte + "), points=[" + startPoint + ", "
        + endPoint + ")}";
  }
}
