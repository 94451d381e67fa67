package com.manna.ledger.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record AccountBalanceResponseDto(UUID accountId, BigDecimal balance, LocalDate asOfDate) {
}
