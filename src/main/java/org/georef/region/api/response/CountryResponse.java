package org.georef.region.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.georef.region.domain.Country;

/** Response DTO for country operations. */
@Schema(description = "Country response")
public record CountryResponse(
    @Schema(
            description = "Unique identifier",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        Long id,
    @Schema(
            description = "Country name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Japan")
        String name,
    @Schema(
            description = "ISO 3166-1 alpha-2 country code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "JP")
        String code) {

  /**
   * Create a response DTO from a domain entity.
   *
   * @param entity The country entity
   * @return CountryResponse
   */
  public static CountryResponse from(Country entity) {
    return new CountryResponse(entity.getId(), entity.getName(), entity.getCode());
  }
}
