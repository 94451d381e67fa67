package com.manna.ledger.exception;

import java.util.UUID;

public class InvalidParentException extends InvalidReferenceException {

    private final UUID parentAccountId;

    public InvalidParentException(UUID parentAccountId, String reason) {
        super("INVALID_PARENT", String.format("Parent account %s %s", parentAccountId, reason));
        this.parentAccountId = parentAccountId;
    }

    public UUID getParentAccountId() {
        return parentAccountId;
    }
}
