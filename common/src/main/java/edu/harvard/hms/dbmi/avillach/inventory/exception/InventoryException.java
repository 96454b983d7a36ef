package edu.harvard.hms.dbmi.avillach.inventory.exception;

/**
 * Base class for operation-level failures that abort a registry, store or query call. Row-level problems found during ingestion are
 * never thrown; they are recorded in the batch's validation report instead.
 */
public abstract class InventoryException extends RuntimeException {

    private static final long serialVersionUID = 4118825303310547032L;

    protected InventoryException(String message) {
        super(message);
    }

    protected InventoryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable code reported to callers alongside the message.
     */
    public abstract String getCode();
}
