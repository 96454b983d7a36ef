package edu.harvard.hms.dbmi.avillach.inventory.exception;

import java.util.UUID;

public class QueryCancelledException extends InventoryException {

    private static final long serialVersionUID = -1846027113985537340L;

    public QueryCancelledException(UUID queryId) {
        super("Query " + queryId + " was cancelled");
    }

    @Override
    public String getCode() {
        return "QueryCancelled";
    }
}
