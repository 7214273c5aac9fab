package org.georef.region.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.georef.region.domain.State;

/** Response DTO for state/province operations. */
@Schema(description = "State/province response")
public record StateResponse(
    @Schema(
            description = "Unique identifier",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        Long id,
    @Schema(
            description = "ID of the country the state belongs to",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        Long countryId,
    @Schema(
            description = "State/province name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Tokyo")
        String name,
    @Schema(
            description = "ISO 3166-2 subdivision code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "JP-13")
        String code) {

  public static StateResponse from(State entity) {
    return new StateResponse(
        entity.getId(), entity.getCountryId(), entity.getName(), entity.getCode());
  }
}
