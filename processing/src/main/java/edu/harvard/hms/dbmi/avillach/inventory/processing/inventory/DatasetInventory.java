package edu.harvard.hms.dbmi.avillach.inventory.processing.inventory;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Which datasets hold data for which participants.
 *
 * @param participantsByDataset number of participants with at least one current value in each dataset of the schema
 * @param datasetsByParticipant for every known participant, the datasets it has current values in (empty when none)
 */
public record DatasetInventory(
    int schemaVersion, int participantCount, SortedMap<String, Integer> participantsByDataset,
    SortedMap<Integer, List<String>> datasetsByParticipant, long snapshot
) {

    public boolean has(int participantId, String dataset) {
        return datasetsByParticipant.getOrDefault(participantId, List.of()).contains(dataset);
    }

    public Map<String, Boolean> availability(int participantId) {
        Map<String, Boolean> flags = new TreeMap<>();
        participantsByDataset.keySet().forEach(dataset -> flags.put("has_" + dataset, has(participantId, dataset)));
        return flags;
    }
}
