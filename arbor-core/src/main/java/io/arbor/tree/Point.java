package io.arbor.tree;

/** A zero-based row/column position in source text. Columns are counted in bytes. */
public final class Point implements Comparable<Point> {
  public static final Point ZERO = new Point(0, 0);
  public static final Point MAX = new Point(Integer.MAX_VALUE, Integer.MAX_VALUE);

  private final int row;
  private final int column;

  public Point(int row, int column) {
    this.row = row;
    this.column = column;
  }

  public int row() {
    return row;
  }

  public int column() {
    return column;
  }

  @Override
  public int compareTo(Point o) {
    int cmp = Integer.compare(row, o.row);
    return cmp != 0 ? cmp : Integer.compare(column, o.column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Point)) return false;
    Point other = (Point) o;
    return row == other.row && column == other.column;
  }

  @Override
  public int hashCode() {
    return 31 * row + column;
  }

  @Override
  public String toString() {
    return "(" + row + ", " + column + ")";
  }
}
