package edu.harvard.hms.dbmi.avillach.inventory.service.schema;

import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.processing.schema.SchemaRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RequestMapping(value = "schema", produces = "application/json")
@RestController
public class SchemaController {

    private final SchemaRegistry schemaRegistry;

    @Autowired
    public SchemaController(SchemaRegistry schemaRegistry) {
        this.schemaRegistry = schemaRegistry;
    }

    @PostMapping
    public SchemaVersion publish(@RequestBody SchemaDraft draft) {
        return schemaRegistry.publish(draft.definitions(), draft.datasets());
    }

    @GetMapping("/current")
    public SchemaVersion current() {
        return schemaRegistry.current();
    }

    @GetMapping("/versions")
    public List<Integer> versions() {
        return schemaRegistry.versions();
    }

    @GetMapping("/{version}")
    public SchemaVersion version(@PathVariable int version) {
        return schemaRegistry.get(version);
    }

    @PostMapping("/retire/{name}")
    public SchemaVersion retire(@PathVariable String name) {
        return schemaRegistry.retire(name);
    }
}
