package org.georef.region.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Error body returned for every failed request.
 *
 * @param type Broad error category, one of {@code NOT_FOUND}, {@code APPLICATION_ERROR},
 *     {@code INVALID_REQUEST} or {@code INTERNAL_ERROR}
 * @param message Human readable description
 * @param code Machine readable error kind, or null for request validation failures
 */
@Schema(description = "Error response")
public record ApiErrorResponse(
    @Schema(
            description = "Error category",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "APPLICATION_ERROR")
        String type,
    @Schema(
            description = "Error message",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Country with code 'JP' already exists")
        String message,
    @Schema(
            description = "Error kind",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "DUPLICATE_CODE")
        String code) {

  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String APPLICATION_ERROR = "APPLICATION_ERROR";
  public static final String INVALID_REQUEST = "INVALID_REQUEST";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
