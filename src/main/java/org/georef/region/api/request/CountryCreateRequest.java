package org.georef.region.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

import org.georef.region.domain.Country;

/**
 * Request DTO for creating a country.
 *
 * <p>The code may be sent in any case; it is stored upper-cased.
 */
@Schema(description = "Request to create a new country")
public record CountryCreateRequest(
    @Schema(
            description = "Country name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Japan")
        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must not exceed 100 characters")
        String name,
    @Schema(
            description = "ISO 3166-1 alpha-2 country code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "JP")
        @NotBlank(message = "Code is required")
        @Size(min = 2, max = 2, message = "Code must be exactly 2 characters")
        String code) {

  /**
   * Convert this request DTO to a domain entity.
   *
   * @return Country entity
   */
  public Country toEntity() {
    var entity = new Country();
    entity.setName(name);
    entity.setCode(code);

    return entity;
  }
}
