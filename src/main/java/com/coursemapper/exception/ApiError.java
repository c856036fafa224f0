package com.coursemapper.exception;

import java.time.Instant;

/** Error body returned when a run aborts. */
public record ApiError(String errorId, String code, String message, String institution, String requirementId,
                       String node, Instant timestamp, String path) {

    public static final String STRUCTURAL_ERROR = "STRUCTURE_001";
}
