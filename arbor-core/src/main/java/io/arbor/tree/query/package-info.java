/**
 * Service interface of the structural query engine: compiled patterns, their raw predicate steps
 * and the stream of unfiltered matches.
 */
package io.arbor.tree.query;
