/**
 * Corpus assembly from per-session files.
 *
 * <p>Merging is sort-then-unique by utterance id, so reruns and different input orders produce
 * identical tables.
 */
package com.phillippitts.parlcorpus.service.assembly;
