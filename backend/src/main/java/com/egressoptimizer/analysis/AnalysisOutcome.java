package com.egressoptimizer.analysis;

import com.egressoptimizer.domain.model.AnalysisStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.Optional;

/**
 * Result of one analyzer invocation.
 *
 * Analyzers never throw across their boundary. They return one of:
 * - {@link Success}: the analysis ran and produced data
 * - {@link Empty}: there was nothing (or not enough) to analyze
 * - {@link Failed}: an unexpected error was caught and downgraded
 *
 * Serialized as a flat object carrying a {@code status} field, with the success
 * payload unwrapped next to it.
 */
public sealed interface AnalysisOutcome<T>
        permits AnalysisOutcome.Success, AnalysisOutcome.Empty, AnalysisOutcome.Failed {

    AnalysisStatus status();

    @JsonIgnore
    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    /**
     * The payload when successful.
     */
    default Optional<T> value() {
        if (this instanceof Success<T> success) {
            return Optional.of(success.data());
        }
        return Optional.empty();
    }

    static <T> AnalysisOutcome<T> success(T data) {
        return new Success<>(data);
    }

    static <T> AnalysisOutcome<T> noData() {
        return new Empty<>(AnalysisStatus.NO_DATA, null, null, null);
    }

    static <T> AnalysisOutcome<T> noEgressData() {
        return new Empty<>(AnalysisStatus.NO_EGRESS_DATA, null, null, null);
    }

    static <T> AnalysisOutcome<T> insufficientData(String message, int required, int available) {
        return new Empty<>(AnalysisStatus.INSUFFICIENT_DATA, message, required, available);
    }

    static <T> AnalysisOutcome<T> failed(String message) {
        return new Failed<>(message);
    }

    static <T> AnalysisOutcome<T> failed(Exception cause) {
        String message = cause.getMessage();
        return new Failed<>(message != null ? message : cause.getClass().getSimpleName());
    }

    record Success<T>(@JsonUnwrapped T data) implements AnalysisOutcome<T> {
        @Override
        @JsonProperty("status")
        public AnalysisStatus status() {
            return AnalysisStatus.SUCCESS;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Empty<T>(
            AnalysisStatus status,
            String message,
            Integer required,
            Integer available
    ) implements AnalysisOutcome<T> {}

    record Failed<T>(String error) implements AnalysisOutcome<T> {
        @Override
        @JsonProperty("status")
        public AnalysisStatus status() {
            return AnalysisStatus.ERROR;
        }
    }
}
