package com.github.raff.webhook.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/**
 * Error body returned to the calling platform.
 *
 * @param platform path segment the delivery was posted to, when the route matched
 * @param details  context from the failure, e.g. the unknown store id
 */
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiError(
        String code,
        String message,
        String platform,
        Instant timestamp,
        Map<String, String> details
) {
    public static ApiError of(String code, String message, String platform) {
        return ApiError.builder().code(code).message(message).platform(platform).timestamp(Instant.now()).build();
    }
}
