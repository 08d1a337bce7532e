/**
 * Read-only view of parsed syntax trees, as provided by a parsing engine.
 *
 * <p>These interfaces are implemented by the parser integration. Arbor only reads trees through
 * them and never creates or edits nodes.
 */
package io.arbor.tree;
