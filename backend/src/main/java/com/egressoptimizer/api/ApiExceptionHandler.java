package com.egressoptimizer.api;

import com.egressoptimizer.analysis.AnalysisOutcome;
import com.egressoptimizer.cost.PricingConfigurationException;
import com.egressoptimizer.ingestion.MetricCollectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps input errors to HTTP 400 with the same {status, error} body analyzers use.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({
            IllegalArgumentException.class,
            MetricCollectionException.class,
            PricingConfigurationException.class
    })
    public ResponseEntity<AnalysisOutcome<Void>> handleInvalidInput(RuntimeException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(AnalysisOutcome.failed(e));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<AnalysisOutcome<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Rejected unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(AnalysisOutcome.failed("Malformed request body"));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            MethodArgumentNotValidException.class
    })
    public ResponseEntity<AnalysisOutcome<Void>> handleBadParameter(Exception e) {
        log.warn("Rejected request parameter: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(AnalysisOutcome.failed(e));
    }
}
