package com.manna.ledger.controller.dto;

import com.manna.ledger.model.ChartAccount;
import java.util.List;

public record ChartAccountsListResponseDto(List<ChartAccount> accounts, String traceId) {
}
