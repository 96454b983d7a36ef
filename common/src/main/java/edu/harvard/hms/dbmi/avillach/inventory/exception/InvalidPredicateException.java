package edu.harvard.hms.dbmi.avillach.inventory.exception;

public class InvalidPredicateException extends InventoryException {

    private static final long serialVersionUID = -3372245712297409712L;

    public InvalidPredicateException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "InvalidPredicate";
    }
}
