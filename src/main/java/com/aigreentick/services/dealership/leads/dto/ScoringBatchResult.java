package com.aigreentick.services.dealership.leads.dto;

import java.util.List;

public record ScoringBatchResult(int processed, int failed, List<Long> failedCustomerIds) {
}
