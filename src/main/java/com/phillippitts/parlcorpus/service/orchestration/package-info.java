/**
 * Session processing and pipeline runs.
 */
package com.phillippitts.parlcorpus.service.orchestration;
