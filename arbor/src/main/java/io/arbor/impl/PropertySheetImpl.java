package io.arbor.impl;

import io.arbor.api.PropertyCursor;
import io.arbor.api.PropertySheet;
import io.arbor.tree.Tree;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/** Immutable compiled property sheet. Property sets and patterns are addressed by index. */
public final class PropertySheetImpl<P> implements PropertySheet<P> {
  private final PropertyState[] states;
  private final List<P> propertySets;
  private final Pattern[] regexes;

  PropertySheetImpl(PropertyState[] states, List<P> propertySets, Pattern[] regexes) {
    this.states = states;
    this.propertySets = Collections.unmodifiableList(new ArrayList<>(propertySets));
    this.regexes = regexes;
  }

  @Override
  public PropertyCursor<P> walk(Tree tree, byte[] source) {
    return new PropertyCursorImpl<>(
        Objects.requireNonNull(tree, "tree"), this, Objects.requireNonNull(source, "source"));
  }

  @Override
  public int stateCount() {
    return states.length;
  }

  @Override
  public int propertySetCount() {
    return propertySets.size();
  }

  @Override
  public P propertySet(int propertySetId) {
    return propertySets.get(propertySetId);
  }

  @Override
  public int regexCount() {
    return regexes.length;
  }

  @Override
  public String regexPattern(int regexIndex) {
    return regexes[regexIndex].pattern();
  }

  @Override
  public <T, E extends Exception> PropertySheet<T> map(
      PropertySetMapper<? super P, ? extends T, E> mapper) throws E {
    List<T> mapped = new ArrayList<>(propertySets.size());
    for (P propertySet : propertySets) {
      mapped.add(mapper.apply(propertySet));
    }
    return new PropertySheetImpl<>(states, mapped, regexes);
  }

  PropertyState state(int stateId) {
    return states[stateId];
  }

  Pattern regex(int regexIndex) {
    return regexes[regexIndex];
  }
}
