package org.georef.region.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

import org.georef.region.domain.City;

/**
 * Request DTO for creating a city or municipality.
 *
 * <p>The code is a six-digit local government code (JIS X 0402 in Japan, e.g. 131032 for Minato
 * ward, Tokyo). Only active cities compete for a code, so a city may be created inactive with a
 * code an active city already holds.
 */
@Schema(description = "Request to create a new city/municipality")
public record CityCreateRequest(
    @Schema(
            description = "ID of the parent state",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        @NotNull(message = "State ID is required")
        @Positive(message = "State ID must be positive")
        Long stateId,
    @Schema(
            description = "City name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Minato")
        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must not exceed 100 characters")
        String name,
    @Schema(
            description = "Six-digit local government code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "131032")
        @NotBlank(message = "Code is required")
        @Pattern(regexp = CityCreateRequest.CODE_PATTERN, message = "Code must be a 6-digit number")
        String code,
    @Schema(
            description = "Whether the city is currently active",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "true",
            defaultValue = "true")
        Boolean active) {

  static final String CODE_PATTERN = "^[0-9]{6}$";

  /**
   * Convert this request DTO to a domain entity. A missing {@code active} flag means active.
   *
   * @return City entity
   */
  public City toEntity() {
    var entity = new City();
    entity.setStateId(stateId);
    entity.setName(name);
    entity.setCode(code);
    entity.setActive(active == null || active);

    return entity;
  }
}
