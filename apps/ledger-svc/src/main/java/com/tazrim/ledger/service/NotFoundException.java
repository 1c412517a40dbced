package com.tazrim.ledger.service;

/**
 * Thrown when a draft, draft row, counterparty, category, batch or activity id does not exist.
 */
public class NotFoundException extends RuntimeException {

    private final String resource;

    public NotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
