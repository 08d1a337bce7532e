package io.arbor.impl;

import io.arbor.tree.Language;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;

/**
 * A state of a compiled property sheet.
 *
 * <p>Candidate transitions live in a single table keyed by {@code (bucket type, id)}: field buckets
 * are keyed by field id, kind buckets by node kind id. Each bucket keeps declaration order.
 */
final class PropertyState {
  static final int KIND_BUCKET = 0;
  static final int FIELD_BUCKET = 1;

  private static final PropertyTransition[] NO_TRANSITIONS = new PropertyTransition[0];

  private final Long2ObjectMap<PropertyTransition[]> buckets;
  final int propertySetId;
  final int defaultNextStateId;

  PropertyState(
      Long2ObjectMap<PropertyTransition[]> buckets, int propertySetId, int defaultNextStateId) {
    this.buckets = buckets;
    this.propertySetId = propertySetId;
    this.defaultNextStateId = defaultNextStateId;
  }

  static long bucketKey(int bucketType, int id) {
    return ((long) bucketType << 32) | (id & 0xFFFFFFFFL);
  }

  /**
   * Selects the candidates for a node: the field bucket when the node has a field and this state
   * has a bucket for it, the node kind bucket otherwise.
   */
  PropertyTransition[] candidates(int fieldId, int kindId) {
    if (fieldId != Language.NO_FIELD) {
      PropertyTransition[] transitions = buckets.get(bucketKey(FIELD_BUCKET, fieldId));
      if (transitions != null) {
        return transitions;
      }
    }
    PropertyTransition[] transitions = buckets.get(bucketKey(KIND_BUCKET, kindId));
    return transitions != null ? transitions : NO_TRANSITIONS;
  }

  /** @return the field bucket, or {@code null} if this state has none for {@code fieldId} */
  PropertyTransition[] fieldTransitions(int fieldId) {
    return buckets.get(bucketKey(FIELD_BUCKET, fieldId));
  }

  /** @return the kind bucket, or {@code null} if this state has none for {@code kindId} */
  PropertyTransition[] kindTransitions(int kindId) {
    return buckets.get(bucketKey(KIND_BUCKET, kindId));
  }
}
