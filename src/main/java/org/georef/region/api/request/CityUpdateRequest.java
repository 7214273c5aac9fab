package org.georef.region.api.request;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import org.georef.region.service.dto.CityUpdate;

/**
 * Request DTO for a partial city update. Omitted fields are left unchanged.
 *
 * <p>{@code active=false} deactivates the city and {@code active=true} re-activates it. The parent
 * state cannot be changed.
 */
@Schema(description = "Request to update an existing city; omitted fields are unchanged")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CityUpdateRequest(
    @Schema(description = "City name", example = "Minato")
        @Pattern(regexp = "(?s).*\\S.*", message = "Name must not be blank")
        @Size(max = 100, message = "Name must not exceed 100 characters")
        String name,
    @Schema(description = "Six-digit local government code", example = "131032")
        @Pattern(regexp = CityCreateRequest.CODE_PATTERN, message = "Code must be a 6-digit number")
        String code,
    @Schema(description = "Whether the city is currently active", example = "false")
        Boolean active) {

  public CityUpdate toUpdate() {
    return new CityUpdate(name, code, active);
  }
}
