package io.arbor.api;

import java.util.Objects;

/** A {@code (key, value)} pair declared on a pattern with {@code (set! key value)}. */
public final class QueryProperty {
  private final String key;
  private final String value;

  public QueryProperty(String key, String value) {
    this.key = Objects.requireNonNull(key, "key");
    this.value = Objects.requireNonNull(value, "value");
  }

  public String key() {
    return key;
  }

  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QueryProperty)) return false;
    QueryProperty other = (QueryProperty) o;
    return key.equals(other.key) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return 31 * key.hashCode() + value.hashCode();
  }

  @Override
  public String toString() {
    return "(" + key + ", " + value + ")";
  }
}
