package com.manna.ledger.model;

import java.util.UUID;

/**
 * Result of deleting a ledger account. A referenced account is kept and only deactivated.
 */
public record AccountDeletion(UUID accountId, String accountCode, boolean deactivated) {
}
