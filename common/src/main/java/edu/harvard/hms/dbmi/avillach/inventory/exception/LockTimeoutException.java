package edu.harvard.hms.dbmi.avillach.inventory.exception;

/**
 * Thrown when the exclusive section of a participant could not be entered within the configured wait. Transient: callers may retry.
 */
public class LockTimeoutException extends InventoryException {

    private static final long serialVersionUID = 7395014838276629018L;

    private final int participantId;

    public LockTimeoutException(int participantId, long timeoutMillis) {
        super("Timed out after " + timeoutMillis + "ms waiting for the merge lock of participant " + participantId);
        this.participantId = participantId;
    }

    public int getParticipantId() {
        return participantId;
    }

    @Override
    public String getCode() {
        return "LockTimeout";
    }
}
