/**
 * Public API of Arbor.
 *
 * <p><b>Property sheets</b>
 *
 * <ul>
 *   <li>{@link io.arbor.api.PropertySheet} compiles a JSON state machine against a grammar.
 *   <li>{@link io.arbor.api.PropertyCursor} walks a tree and reports the property set of each node.
 * </ul>
 *
 * <p><b>Queries</b>
 *
 * <ul>
 *   <li>{@link io.arbor.api.Query} compiles the {@code eq?}, {@code match?} and {@code set!}
 *       clauses of a structural query.
 *   <li>{@link io.arbor.api.QueryCursor} filters the engine's raw matches with those predicates.
 * </ul>
 *
 * <p><b>Threading</b>
 *
 * <ul>
 *   <li>Compiled sheets and queries are immutable and can be shared between threads.
 *   <li>Cursors and the iterators they return are single-threaded; create one per traversal.
 * </ul>
 *
 * <p>Compilation failures are reported as checked {@link io.arbor.api.ArborException}s. Traversal
 * and filtering never fail: missing transitions fall back to defaults and unsatisfiable predicates
 * drop the match.
 */
package io.arbor.api;
