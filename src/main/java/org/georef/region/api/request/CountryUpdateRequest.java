package org.georef.region.api.request;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import org.georef.region.service.dto.CountryUpdate;

/** Request DTO for a partial country update. Omitted fields are left unchanged. */
@Schema(description = "Request to update an existing country; omitted fields are unchanged")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CountryUpdateRequest(
    @Schema(description = "Country name", example = "Japan")
        @Pattern(regexp = "(?s).*\\S.*", message = "Name must not be blank")
        @Size(max = 100, message = "Name must not exceed 100 characters")
        String name,
    @Schema(description = "ISO 3166-1 alpha-2 country code", example = "JP")
        @Size(min = 2, max = 2, message = "Code must be exactly 2 characters")
        String code) {

  public CountryUpdate toUpdate() {
    return new CountryUpdate(name, code);
  }
}
