package com.affordabot.backend.gateway.cost;

import java.math.BigDecimal;
import java.time.Instant;

public record CostLedgerEntry(
    Instant timestamp, String providerId, String step, BigDecimal amount, BigDecimal runningTotal) {}
