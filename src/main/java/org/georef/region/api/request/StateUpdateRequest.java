package org.georef.region.api.request;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import org.georef.region.service.dto.StateUpdate;

/**
 * Request DTO for a partial state update. Omitted fields are left unchanged; a new country ID
 * moves the state to that country.
 */
@Schema(description = "Request to update an existing state/province; omitted fields are unchanged")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StateUpdateRequest(
    @Schema(description = "ID of the new parent country", example = "1")
        @Positive(message = "Country ID must be positive")
        Long countryId,
    @Schema(description = "State/province name", example = "Tokyo")
        @Pattern(regexp = "(?s).*\\S.*", message = "Name must not be blank")
        @Size(max = 100, message = "Name must not exceed 100 characters")
        String name,
    @Schema(description = "ISO 3166-2 subdivision code", example = "JP-13")
        @Pattern(
            regexp = StateCreateRequest.CODE_PATTERN,
            message = "Code must be in ISO 3166-2 format (e.g. 'JP-13', 'US-CA')")
        String code) {

  public StateUpdate toUpdate() {
    return new StateUpdate(countryId, name, code);
  }
}
