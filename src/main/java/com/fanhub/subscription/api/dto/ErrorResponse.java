package com.fanhub.subscription.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every failed subscription API call.
 *
 * Example:
 * <pre>
 * {
 *   "timestamp": "2024-05-01T10:15:30Z",
 *   "status": 400,
 *   "error": "Resubscribe Too Soon",
 *   "message": "Cannot resubscribe to player 42 yet. Try again in 3600 seconds",
 *   "path": "/api/v1/subscriptions/player/42",
 *   "details": { "retryAfterSeconds": 3600, "availableAt": "2024-05-01T11:15:30Z" }
 * }
 * </pre>
 *
 * @author FanHub Team
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    private Instant timestamp = Instant.now();
    private Integer status;
    private String error;
    private String message;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        ErrorResponse response = new ErrorResponse();
        response.setStatus(status.value());
        response.setError(error);
        response.setMessage(message);
        response.setPath(path);
        return response;
    }

    /**
     * Add a detail entry.
     *
     * @param key Detail key
     * @param value Detail value
     * @return This ErrorResponse for method chaining
     */
    public ErrorResponse addDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }
}
