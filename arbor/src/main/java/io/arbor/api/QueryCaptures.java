package io.arbor.api;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily filtered captures of one query execution, in the order the engine reports them. Single
 * pass, like {@link QueryMatches}.
 */
public interface QueryCaptures extends Iterator<QueryCapture> {

  /** @return the remaining captures as a sequential stream */
  default Stream<QueryCapture> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }
}
