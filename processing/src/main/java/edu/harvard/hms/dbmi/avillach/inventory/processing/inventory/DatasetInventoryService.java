package edu.harvard.hms.dbmi.avillach.inventory.processing.inventory;

import com.google.common.collect.ImmutableSortedMap;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.DatasetDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.processing.identity.IdentityResolver;
import edu.harvard.hms.dbmi.avillach.inventory.processing.schema.SchemaRegistry;
import edu.harvard.hms.dbmi.avillach.inventory.processing.store.VariableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Summarizes dataset availability per participant from the current values of each dataset's variables.
 */
@Component
public class DatasetInventoryService {

    private static final Logger log = LoggerFactory.getLogger(DatasetInventoryService.class);

    private final SchemaRegistry schemaRegistry;

    private final VariableStore variableStore;

    private final IdentityResolver identityResolver;

    @Autowired
    public DatasetInventoryService(SchemaRegistry schemaRegistry, VariableStore variableStore, IdentityResolver identityResolver) {
        this.schemaRegistry = schemaRegistry;
        this.variableStore = variableStore;
        this.identityResolver = identityResolver;
    }

    public DatasetInventory summarize() {
        SchemaVersion schema = schemaRegistry.current();
        long snapshot = variableStore.snapshot();
        SortedSet<Integer> participantIds = variableStore.visibleParticipants(identityResolver.participantIds(), snapshot);

        Map<Integer, SortedSet<String>> datasetsByParticipant = new TreeMap<>();
        participantIds.forEach(participantId -> datasetsByParticipant.put(participantId, new TreeSet<>()));
        Map<String, Integer> participantsByDataset = new TreeMap<>();
        for (DatasetDefinition dataset : schema.datasets().values()) {
            Set<Integer> withData = new HashSet<>();
            for (VariableDefinition variable : schema.variablesOf(dataset.name())) {
                withData.addAll(variableStore.currentValues(variable.name(), snapshot).keySet());
            }
            withData.retainAll(participantIds);
            withData.forEach(participantId -> datasetsByParticipant.get(participantId).add(dataset.name()));
            participantsByDataset.put(dataset.name(), withData.size());
        }

        ImmutableSortedMap.Builder<Integer, List<String>> byParticipant = ImmutableSortedMap.naturalOrder();
        datasetsByParticipant.forEach((participantId, datasets) -> byParticipant.put(participantId, List.copyOf(datasets)));
        log.debug("Inventory of {} participants across {} datasets", participantIds.size(), participantsByDataset.size());
        return new DatasetInventory(
            schema.version(), participantIds.size(), ImmutableSortedMap.copyOf(participantsByDataset), byParticipant.build(), snapshot
        );
    }

    /**
     * Number of participants with a current value for the variable.
     */
    public int coverage(String variable) {
        return variableStore.coverage(variable);
    }
}
