package io.arbor.api;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily filtered matches of one query execution. Single pass: run the query again through a
 * {@link QueryCursor} to start over.
 */
public interface QueryMatches extends Iterator<QueryMatch> {

  /** @return the remaining matches as a sequential stream */
  default Stream<QueryMatch> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }
}
