package com.coursemapper.api;

import com.coursemapper.exception.ApiError;
import com.coursemapper.exception.StructuralException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.UUID;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StructuralException.class)
    public ResponseEntity<ApiError> handleStructural(StructuralException ex, HttpServletRequest request) {
        String errorId = UUID.randomUUID().toString().substring(0, 8);
        log.error("Mapping run aborted [{}]: {}", errorId, ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiError(errorId, ApiError.STRUCTURAL_ERROR, ex.getMessage(), ex.getInstitution(),
                        ex.getRequirementId(), ex.getNode(), Instant.now(), request.getRequestURI()));
    }
}
