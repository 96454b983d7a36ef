package edu.harvard.hms.dbmi.avillach.inventory.service.audit;

import edu.harvard.hms.dbmi.avillach.inventory.data.participant.Participant;
import edu.harvard.hms.dbmi.avillach.inventory.data.store.VariableValue;
import edu.harvard.hms.dbmi.avillach.inventory.processing.identity.IdentityResolver;
import edu.harvard.hms.dbmi.avillach.inventory.processing.identity.PendingResolution;
import edu.harvard.hms.dbmi.avillach.inventory.processing.identity.ResolutionLogEntry;
import edu.harvard.hms.dbmi.avillach.inventory.processing.inventory.DatasetInventory;
import edu.harvard.hms.dbmi.avillach.inventory.processing.inventory.DatasetInventoryService;
import edu.harvard.hms.dbmi.avillach.inventory.processing.store.VariableStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Read-only views of participants, identity decisions and coverage, plus the operator override for unresolved identities.
 */
@RequestMapping(produces = "application/json")
@RestController
public class AuditController {

    private final IdentityResolver identityResolver;

    private final VariableStore variableStore;

    private final DatasetInventoryService datasetInventoryService;

    @Autowired
    public AuditController(IdentityResolver identityResolver, VariableStore variableStore, DatasetInventoryService datasetInventoryService) {
        this.identityResolver = identityResolver;
        this.variableStore = variableStore;
        this.datasetInventoryService = datasetInventoryService;
    }

    @GetMapping("/participants/{participantId}")
    public ParticipantView participant(@PathVariable int participantId) {
        Participant participant = identityResolver.participant(participantId)
            .orElseThrow(() -> new NoSuchElementException("Participant " + participantId + " does not exist"));
        DatasetInventory inventory = datasetInventoryService.summarize();
        return new ParticipantView(participant, variableStore.currentValues(participantId), inventory.availability(participantId));
    }

    @GetMapping("/participants/{participantId}/history/{variable}")
    public List<VariableValue> history(@PathVariable int participantId, @PathVariable String variable) {
        return variableStore.history(participantId, variable);
    }

    @GetMapping("/identity/log")
    public List<ResolutionLogEntry> identityLog() {
        return identityResolver.auditLog();
    }

    @GetMapping("/identity/pending")
    public List<PendingResolution> pending() {
        return identityResolver.pending();
    }

    @PostMapping("/identity/override")
    public Participant override(@RequestBody IdentityOverrideRequest request) {
        if (request.sourceSystem() == null || request.sourceLocalKey() == null) {
            throw new IllegalArgumentException("sourceSystem and sourceLocalKey are required");
        }
        return identityResolver.override(request.sourceSystem(), request.sourceLocalKey(), request.participantId());
    }

    @GetMapping("/coverage/{variable}")
    public Map<String, Object> coverage(@PathVariable String variable) {
        return Map.of("variable", variable, "participants", datasetInventoryService.coverage(variable));
    }

    @GetMapping("/inventory")
    public DatasetInventory inventory() {
        return datasetInventoryService.summarize();
    }
}
