package edu.harvard.hms.dbmi.avillach.inventory.service.util;

public record ErrorResponse(String error, String message) {
}
