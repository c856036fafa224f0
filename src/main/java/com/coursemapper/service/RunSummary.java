package com.coursemapper.service;

import java.util.Map;

/** Outcome of one mapping run. */
public record RunSummary(int plans,
                         Map<String, Integer> blocksByType,
                         int requirements,
                         int courseMappings,
                         Map<String, Long> reportTally,
                         Map<String, Integer> dispatchCounts,
                         long elapsedMillis) {

    public int blocks() {
        return blocksByType.values().stream().mapToInt(Integer::intValue).sum();
    }
}
