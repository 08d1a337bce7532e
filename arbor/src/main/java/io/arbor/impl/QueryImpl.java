package io.arbor.impl;

import io.arbor.api.Query;
import io.arbor.api.QueryPredicate;
import io.arbor.api.QueryProperty;
import io.arbor.tree.query.RawQuery;
import java.util.List;

/** Immutable compiled query: one predicate list and one property list per pattern. */
final class QueryImpl implements Query {
  private final RawQuery rawQuery;
  private final List<String> captureNames;
  private final List<List<QueryPredicate>> predicates;
  private final List<List<QueryProperty>> properties;

  QueryImpl(
      RawQuery rawQuery,
      List<String> captureNames,
      List<List<QueryPredicate>> predicates,
      List<List<QueryProperty>> properties) {
    this.rawQuery = rawQuery;
    this.captureNames = List.copyOf(captureNames);
    this.predicates = List.copyOf(predicates);
    this.properties = List.copyOf(properties);
  }

  @Override
  public RawQuery rawQuery() {
    return rawQuery;
  }

  @Override
  public int patternCount() {
    return predicates.size();
  }

  @Override
  public List<String> captureNames() {
    return captureNames;
  }

  @Override
  public List<QueryPredicate> predicates(int patternIndex) {
    return predicates.get(checkPatternIndex(patternIndex));
  }

  @Override
  public List<QueryProperty> patternProperties(int patternIndex) {
    return properties.get(checkPatternIndex(patternIndex));
  }

  @Override
  public int startByteForPattern(int patternIndex) {
    return rawQuery.startByteForPattern(checkPatternIndex(patternIndex));
  }

  private int checkPatternIndex(int patternIndex) {
    if (patternIndex < 0 || patternIndex >= predicates.size()) {
      throw new IndexOutOfBoundsException(
          "Pattern index is " + patternIndex + " but the pattern count is " + predicates.size());
    }
    return patternIndex;
  }

  @Override
  public String toString() {
    return "Query{patterns=" + predicates.size() + ", captures=" + captureNames + "}";
  }
}
