package io.arbor.impl;

import io.arbor.api.Query;
import io.arbor.api.QueryException;
import io.arbor.api.QueryPredicate;
import io.arbor.api.QueryProperty;
import io.arbor.tree.Language;
import io.arbor.tree.query.PredicateStep;
import io.arbor.tree.query.QueryEngine;
import io.arbor.tree.query.QueryEngineException;
import io.arbor.tree.query.RawQuery;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles the predicate steps of a {@link RawQuery}.
 *
 * <p>Each pattern's steps are split into clauses at {@link PredicateStep.Type#DONE} markers. A
 * clause starts with the function name followed by its arguments:
 *
 * <ul>
 *   <li>{@code (eq? @capture @capture)} and {@code (eq? @capture "literal")}
 *   <li>{@code (match? @capture "regex")}
 *   <li>{@code (set! "key" "value")}, a pattern property rather than a filter
 * </ul>
 *
 * Any other clause fails the whole query.
 */
public final class QueryPredicateCompiler {
  private static final Logger log = LoggerFactory.getLogger(QueryPredicateCompiler.class);

  private final List<String> captureNames;
  private final List<String> strings;

  private QueryPredicateCompiler(List<String> captureNames, List<String> strings) {
    this.captureNames = captureNames;
    this.strings = strings;
  }

  /**
   * Compiles the pattern source with {@code engine}, then compiles its predicates.
   *
   * @param engine the structural engine
   * @param language the grammar
   * @param source the pattern source
   * @return the compiled query
   * @throws QueryException if the engine rejects the source or a predicate is malformed
   */
  public static Query compile(QueryEngine engine, Language language, String source)
      throws QueryException {
    Objects.requireNonNull(engine, "engine");
    Objects.requireNonNull(source, "source");
    RawQuery rawQuery;
    try {
      rawQuery = engine.compile(language, source);
    } catch (QueryEngineException e) {
      log.debug("Structural query engine rejected the query: {}", e.getMessage());
      throw toQueryException(source, e);
    }
    return compile(rawQuery);
  }

  /**
   * Compiles the predicates of an already compiled structural query.
   *
   * @param rawQuery the structural query
   * @return the compiled query
   * @throws QueryException if a predicate is malformed
   */
  public static Query compile(RawQuery rawQuery) throws QueryException {
    Objects.requireNonNull(rawQuery, "rawQuery");
    List<String> captureNames = new ArrayList<>(rawQuery.captureCount());
    for (int i = 0; i < rawQuery.captureCount(); i++) {
      captureNames.add(rawQuery.captureNameForId(i));
    }
    List<String> strings = new ArrayList<>(rawQuery.stringCount());
    for (int i = 0; i < rawQuery.stringCount(); i++) {
      strings.add(rawQuery.stringValueForId(i));
    }

    QueryPredicateCompiler compiler = new QueryPredicateCompiler(captureNames, strings);
    int patternCount = rawQuery.patternCount();
    List<List<QueryPredicate>> predicates = new ArrayList<>(patternCount);
    List<List<QueryProperty>> properties = new ArrayList<>(patternCount);
    int predicateCount = 0;
    for (int i = 0; i < patternCount; i++) {
      List<QueryPredicate> patternPredicates = new ArrayList<>();
      List<QueryProperty> patternProperties = new ArrayList<>();
      for (List<PredicateStep> clause : splitClauses(rawQuery.predicateSteps(i))) {
        compiler.compileClause(clause, patternPredicates, patternProperties);
      }
      predicateCount += patternPredicates.size();
      predicates.add(List.copyOf(patternPredicates));
      properties.add(List.copyOf(patternProperties));
    }
    log.debug(
        "Compiled query: {} patterns, {} captures, {} predicates",
        patternCount,
        captureNames.size(),
        predicateCount);
    return new QueryImpl(rawQuery, captureNames, predicates, properties);
  }

  private static List<List<PredicateStep>> splitClauses(List<PredicateStep> steps) {
    List<List<PredicateStep>> clauses = new ArrayList<>();
    List<PredicateStep> current = new ArrayList<>();
    for (PredicateStep step : steps) {
      if (step.type() == PredicateStep.Type.DONE) {
        if (!current.isEmpty()) {
          clauses.add(current);
          current = new ArrayList<>();
        }
      } else {
        current.add(step);
      }
    }
    if (!current.isEmpty()) {
      clauses.add(current);
    }
    return clauses;
  }

  private void compileClause(
      List<PredicateStep> clause, List<QueryPredicate> predicates, List<QueryProperty> properties)
      throws QueryException {
    PredicateStep head = clause.get(0);
    if (head.type() != PredicateStep.Type.STRING) {
      throw QueryException.predicate(
          String.format(
              "Expected predicate to start with a function name. Got @%s.",
              captureNames.get(head.valueId())));
    }

    String function = strings.get(head.valueId());
    int argCount = clause.size() - 1;
    switch (function) {
      case "eq?" -> {
        checkArgCount(function, argCount);
        int captureId = firstCaptureArg(function, clause);
        PredicateStep second = clause.get(2);
        if (second.type() == PredicateStep.Type.CAPTURE) {
          predicates.add(new QueryPredicate.CaptureEqCapture(captureId, second.valueId()));
        } else {
          predicates.add(
              new QueryPredicate.CaptureEqString(captureId, strings.get(second.valueId())));
        }
      }
      case "match?" -> {
        checkArgCount(function, argCount);
        int captureId = firstCaptureArg(function, clause);
        PredicateStep second = clause.get(2);
        if (second.type() == PredicateStep.Type.CAPTURE) {
          throw QueryException.predicate(
              String.format(
                  "Second argument to match? predicate must be a literal. Got capture @%s.",
                  captureNames.get(second.valueId())));
        }
        String regex = strings.get(second.valueId());
        try {
          predicates.add(new QueryPredicate.CaptureMatchRegex(captureId, Pattern.compile(regex)));
        } catch (PatternSyntaxException e) {
          throw QueryException.predicate(String.format("Invalid regex '%s'", regex), e);
        }
      }
      case "set!" -> {
        checkArgCount(function, argCount);
        PredicateStep key = clause.get(1);
        PredicateStep value = clause.get(2);
        if (key.type() != PredicateStep.Type.STRING || value.type() != PredicateStep.Type.STRING) {
          throw QueryException.predicate("Argument to set! predicate must be strings.");
        }
        properties.add(
            new QueryProperty(strings.get(key.valueId()), strings.get(value.valueId())));
      }
      default -> throw QueryException.predicate("Unknown query predicate function " + function);
    }
  }

  private static void checkArgCount(String function, int argCount) throws QueryException {
    if (argCount != 2) {
      throw QueryException.predicate(
          String.format(
              "Wrong number of arguments to %s predicate. Expected 2, got %d.",
              function, argCount));
    }
  }

  private int firstCaptureArg(String function, List<PredicateStep> clause) throws QueryException {
    PredicateStep first = clause.get(1);
    if (first.type() != PredicateStep.Type.CAPTURE) {
      throw QueryException.predicate(
          String.format(
              "First argument to %s predicate must be a capture name. Got literal \"%s\".",
              function, strings.get(first.valueId())));
    }
    return first.valueId();
  }

  /**
   * Maps an engine error to a {@link QueryException}. For anything but a syntax error, the name
   * reported is the identifier found at the error offset of {@code source}.
   */
  static QueryException toQueryException(String source, QueryEngineException e) {
    int offset = e.getOffset();
    return switch (e.getErrorType()) {
      case NODE_TYPE -> QueryException.nodeType(offset, identifierAt(source, offset));
      case FIELD -> QueryException.field(offset, identifierAt(source, offset));
      case CAPTURE -> QueryException.capture(offset, identifierAt(source, offset));
      case SYNTAX -> QueryException.syntax(offset);
    };
  }

  private static String identifierAt(String source, int byteOffset) {
    byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
    int start = Math.max(0, Math.min(byteOffset, bytes.length));
    String suffix = new String(bytes, start, bytes.length - start, StandardCharsets.UTF_8);
    int end = 0;
    while (end < suffix.length()) {
      char c = suffix.charAt(end);
      if (!Character.isLetterOrDigit(c) && c != '_' && c != '-') {
        break;
      }
      end++;
    }
    return suffix.substring(0, end);
  }
}
