package org.georef.region.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.georef.region.domain.City;

/** Response DTO for city operations. */
@Schema(description = "City/municipality response")
public record CityResponse(
    @Schema(
            description = "Unique identifier",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        Long id,
    @Schema(
            description = "ID of the state the city belongs to",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        Long stateId,
    @Schema(
            description = "City name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Minato")
        String name,
    @Schema(
            description = "Six-digit local government code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "131032")
        String code,
    @Schema(
            description = "Whether the city is currently active",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "true")
        boolean active) {

  /**
   * Create a response DTO from a domain entity.
   *
   * @param entity The city entity
   * @return CityResponse
   */
  public static CityResponse from(City entity) {
    return new CityResponse(
        entity.getId(), entity.getStateId(), entity.getName(), entity.getCode(), entity.isActive());
  }
}
