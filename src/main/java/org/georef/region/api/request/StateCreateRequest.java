package org.georef.region.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

import org.georef.region.domain.State;

/**
 * Request DTO for creating a state or province.
 *
 * <p>Codes follow ISO 3166-2: the country's alpha-2 code, a hyphen, then one to three letters or
 * digits (JP-13, US-CA). Lower case is accepted and stored upper-cased.
 */
@Schema(description = "Request to create a new state/province")
public record StateCreateRequest(
    @Schema(
            description = "ID of the parent country",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "1")
        @NotNull(message = "Country ID is required")
        @Positive(message = "Country ID must be positive")
        Long countryId,
    @Schema(
            description = "State/province name",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Tokyo")
        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must not exceed 100 characters")
        String name,
    @Schema(
            description = "ISO 3166-2 subdivision code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "JP-13")
        @NotBlank(message = "Code is required")
        @Pattern(
            regexp = StateCreateRequest.CODE_PATTERN,
            message = "Code must be in ISO 3166-2 format (e.g. 'JP-13', 'US-CA')")
        String code) {

  static final String CODE_PATTERN = "^[A-Za-z]{2}-[A-Za-z0-9]{1,3}$";

  public State toEntity() {
    var entity = new State();
    entity.setCountryId(countryId);
    entity.setName(name);
    entity.setCode(code);

    return entity;
  }
}
