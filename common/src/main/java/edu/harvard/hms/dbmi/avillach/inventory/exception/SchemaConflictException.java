package edu.harvard.hms.dbmi.avillach.inventory.exception;

import java.util.List;

public class SchemaConflictException extends InventoryException {

    private static final long serialVersionUID = -6172509934425125851L;

    private final List<String> conflicts;

    public SchemaConflictException(List<String> conflicts) {
        super("Schema draft cannot be published: " + String.join("; ", conflicts));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<String> getConflicts() {
        return conflicts;
    }

    @Override
    public String getCode() {
        return "SchemaConflict";
    }
}
