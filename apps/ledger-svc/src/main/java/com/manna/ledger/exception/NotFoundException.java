package com.manna.ledger.exception;

import java.util.UUID;

public class NotFoundException extends LedgerException {

    private final String resource;
    private final String identifier;

    public NotFoundException(String resource, UUID id) {
        this(resource, String.valueOf(id));
    }

    public NotFoundException(String resource, String identifier) {
        super("NOT_FOUND", String.format("%s %s not found", resource, identifier));
        this.resource = resource;
        this.identifier = identifier;
    }

    public String getResource() {
        return resource;
    }

    public String getIdentifier() {
        return identifier;
    }
}
