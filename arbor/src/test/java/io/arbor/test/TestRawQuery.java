package io.arbor.test;

import io.arbor.tree.query.PredicateStep;
import io.arbor.tree.query.RawQuery;
import java.util.ArrayList;
import java.util.List;

/**
 * Hand-assembled structural query. Predicate arguments starting with {@code @} are captures,
 * anything else is a string.
 */
public final class TestRawQuery implements RawQuery {
  private final List<String> captures;
  private final List<String> strings;
  private final List<List<PredicateStep>> steps;
  private final List<Integer> startBytes;

  private TestRawQuery(Builder builder) {
    this.captures = List.copyOf(builder.captures);
    this.strings = List.copyOf(builder.strings);
    List<List<PredicateStep>> copy = new ArrayList<>();
    for (List<PredicateStep> pattern : builder.steps) {
      copy.add(List.copyOf(pattern));
    }
    this.steps = copy;
    this.startBytes = List.copyOf(builder.startBytes);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public int patternCount() {
    return steps.size();
  }

  @Override
  public int captureCount() {
    return captures.size();
  }

  @Override
  public String captureNameForId(int captureId) {
    return captures.get(captureId);
  }

  @Override
  public int stringCount() {
    return strings.size();
  }

  @Override
  public String stringValueForId(int stringId) {
    return strings.get(stringId);
  }

  @Override
  public List<PredicateStep> predicateSteps(int patternIndex) {
    return steps.get(patternIndex);
  }

  @Override
  public int startByteForPattern(int patternIndex) {
    return startBytes.get(patternIndex);
  }

  public static final class Builder {
    private final List<String> captures = new ArrayList<>();
    private final List<String> strings = new ArrayList<>();
    private final List<List<PredicateStep>> steps = new ArrayList<>();
    private final List<Integer> startBytes = new ArrayList<>();

    /** Declares a capture so that its id is fixed before any pattern refers to it. */
    public Builder capture(String name) {
      captureId(name);
      return this;
    }

    public Builder pattern(int startByte) {
      steps.add(new ArrayList<>());
      startBytes.add(startByte);
      return this;
    }

    public Builder pattern() {
      return pattern(startBytes.isEmpty() ? 0 : startBytes.get(startBytes.size() - 1) + 1);
    }

    /** Appends {@code (function args...)} followed by a done marker to the last pattern. */
    public Builder predicate(String function, String... args) {
      List<PredicateStep> pattern = current();
      pattern.add(PredicateStep.string(stringId(function)));
      for (String arg : args) {
        pattern.add(
            arg.startsWith("@")
                ? PredicateStep.capture(captureId(arg.substring(1)))
                : PredicateStep.string(stringId(arg)));
      }
      pattern.add(PredicateStep.done());
      return this;
    }

    public Builder step(PredicateStep step) {
      current().add(step);
      return this;
    }

    public int captureId(String name) {
      int id = captures.indexOf(name);
      if (id < 0) {
        captures.add(name);
        id = captures.size() - 1;
      }
      return id;
    }

    public int stringId(String value) {
      int id = strings.indexOf(value);
      if (id < 0) {
        strings.add(value);
        id = strings.size() - 1;
      }
      return id;
    }

    public TestRawQuery build() {
      return new TestRawQuery(this);
    }

    private List<PredicateStep> current() {
      if (steps.isEmpty()) {
        pattern(0);
      }
      return steps.get(steps.size() - 1);
    }
  }
}
