package com.phillippitts.parlcorpus.service.orchestration;

import com.phillippitts.parlcorpus.service.assembly.AssemblyReport;

import java.util.List;

/**
 * Result of one complete pipeline run.
 *
 * @param sessions        per-session reports, sorted by session id
 * @param assembly        corpus assembly report, null when assembly failed
 * @param vocabularySize  words in the written vocabulary, -1 when it was not written
 * @param assemblyFailure reason assembly failed, null otherwise
 */
public record PipelineSummary(
        List<SessionReport> sessions,
        AssemblyReport assembly,
        int vocabularySize,
        String assemblyFailure
) {

    public PipelineSummary {
        sessions = List.copyOf(sessions);
    }

    public int kept() {
        return sessions.stream().mapToInt(SessionReport::kept).sum();
    }

    public int dropped() {
        return sessions.stream().mapToInt(SessionReport::dropped).sum();
    }

    public int queued() {
        return sessions.stream().mapToInt(SessionReport::queued).sum();
    }

    public int unresolved() {
        return sessions.stream().mapToInt(SessionReport::unresolved).sum();
    }

    public List<SessionReport> failures() {
        return sessions.stream().filter(SessionReport::isFailed).toList();
    }

    public boolean assemblySucceeded() {
        return assemblyFailure == null;
    }
}
