package com.phillippitts.parlcorpus.service.assembly;

import java.util.List;

/**
 * Outcome of one corpus assembly.
 *
 * @param inputRecords      records read from session files and existing tables
 * @param writtenRecords    records in the written tables
 * @param conflicts         utterance ids excluded because of conflicting variants
 * @param missingAudio      records excluded because their audio file does not exist
 * @param filteredMinority  records removed by the secondary language filter
 * @param sessions          distinct sessions in the written tables
 * @param speakers          distinct speaker ids in the written tables
 */
public record AssemblyReport(
        int inputRecords,
        int writtenRecords,
        List<MergeConflict> conflicts,
        int missingAudio,
        int filteredMinority,
        int sessions,
        int speakers
) {

    public AssemblyReport {
        conflicts = List.copyOf(conflicts);
    }

    public int conflictCount() {
        return conflicts.size();
    }
}
