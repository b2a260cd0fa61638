package com.tally.common.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

/**
 * API Response wrapper
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private T data;
    private boolean success;
    private String message;
    private String errorCode;
    private Object error;
    private Boolean retryable;
    private Instant timestamp;

    @JsonIgnore
    @Builder.Default
    private HttpStatus status = HttpStatus.OK;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
            .data(data)
            .success(true)
            .timestamp(Instant.now())
            .build();
    }

    public static <T> ApiResponse<T> success(T data, String message) {
        return ApiResponse.<T>builder()
            .data(data)
            .success(true)
            .message(message)
            .timestamp(Instant.now())
            .build();
    }

    public static <T> ApiResponse<T> created(T data) {
        return ApiResponse.<T>builder()
            .data(data)
            .success(true)
            .status(HttpStatus.CREATED)
            .timestamp(Instant.now())
            .build();
    }

    public static <T> ApiResponse<T> error(HttpStatus status, String errorCode, String message) {
        return ApiResponse.<T>builder()
            .success(false)
            .message(message)
            .errorCode(errorCode)
            .status(status)
            .timestamp(Instant.now())
            .build();
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message);
    }

    public static <T> ApiResponse<T> validationError(Object errors) {
        ApiResponse<T> response = error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed");
        response.setError(errors);
        return response;
    }

    public static <T> ApiResponse<T> internalError(String message) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", message);
    }

    public ApiResponse<T> withError(Object details) {
        this.error = details;
        return this;
    }

    public ApiResponse<T> withRetryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    public ResponseEntity<ApiResponse<T>> toResponseEntity() {
        return ResponseEntity.status(status).body(this);
    }
}
