/**
 * Pipeline services.
 *
 * <p>Per-session stages run in this order: {@code transcript} (parse), {@code speaker}
 * (resolve), {@code language} (classify), {@code text} (normalize), {@code decoder} (read
 * candidates), {@code reconcile} and {@code labeling}. {@code orchestration} drives the
 * sessions in parallel and hands their files to {@code assembly}, which builds the corpus
 * tables after all sessions have finished.
 */
package com.phillippitts.parlcorpus.service;
