package edu.harvard.hms.dbmi.avillach.inventory.exception;

public class UnknownVersionException extends InventoryException {

    private static final long serialVersionUID = 2920574402318187346L;

    private final Integer version;

    public UnknownVersionException(Integer version) {
        super(version == null ? "No schema version has been published" : "Unknown schema version: " + version);
        this.version = version;
    }

    public Integer getVersion() {
        return version;
    }

    @Override
    public String getCode() {
        return "UnknownVersion";
    }
}
