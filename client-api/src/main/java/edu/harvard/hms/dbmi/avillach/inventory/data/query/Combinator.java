package edu.harvard.hms.dbmi.avillach.inventory.data.query;

public enum Combinator {
    // participants matching every clause
    AND,
    // participants matching at least one clause
    OR
}
