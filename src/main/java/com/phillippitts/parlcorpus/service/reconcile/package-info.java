/**
 * Matching of decoder hypotheses against the session's reference words.
 *
 * <p>{@link com.phillippitts.parlcorpus.service.reconcile.AbstractAlignmentReconciler} owns the
 * search cursor and the classification thresholds; implementations in {@code impl} decide how
 * the best reference span is found.
 */
package com.phillippitts.parlcorpus.service.reconcile;
