package com.caltrade.backend.dto;

import com.caltrade.backend.model.ExecutionRecord;

import java.util.List;

public record LedgerResponse(int count, int capacity, List<ExecutionRecord> entries) {
}
