package org.georef.region.api;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.georef.region.api.request.CityCreateRequest;
import org.georef.region.api.request.CityUpdateRequest;
import org.georef.region.api.response.ApiErrorResponse;
import org.georef.region.api.response.CityResponse;
import org.georef.region.service.CityService;

/**
 * Endpoints for managing cities and municipalities.
 *
 * <p>Inactive cities are hidden from every endpoint unless {@code includeInactive=true} is passed,
 * including update and delete.
 */
@Tag(name = "City Handler", description = "Endpoints for creating, querying and deleting cities")
@RestController
@RequestMapping(path = "/v1/cities")
public class CityController {

  private static final Logger log = LoggerFactory.getLogger(CityController.class);

  private final CityService cityService;
  private final RequestInfoResolver requestInfoResolver;
  private final PaginationResolver paginationResolver;

  public CityController(
      CityService cityService,
      RequestInfoResolver requestInfoResolver,
      PaginationResolver paginationResolver) {
    this.cityService = cityService;
    this.requestInfoResolver = requestInfoResolver;
    this.paginationResolver = paginationResolver;
  }

  @Operation(
      summary = "Create a new city",
      description =
          "Create a city under an existing state. Codes are unique among active cities only, so "
              + "an inactive city may share a code with an active one.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "201",
            description = "City created successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CityResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "State not found"),
        @ApiResponse(
            responseCode = "409",
            description = "An active city already holds the code",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples =
                        @ExampleObject(
                            name = "Duplicate Active City Code",
                            value =
                                """
                                {
                                  "type": "APPLICATION_ERROR",
                                  "message": "Active city with code '131032' already exists",
                                  "code": "DUPLICATE_CODE"
                                }
                                """)))
      })
  @PostMapping(produces = "application/json", consumes = "application/json")
  @ResponseStatus(HttpStatus.CREATED)
  public ResponseEntity<CityResponse> create(
      @Valid @RequestBody CityCreateRequest request, HttpServletRequest httpRequest) {
    log.info("Creating city code: {} for state id: {}", request.code(), request.stateId());

    var requestInfo = requestInfoResolver.resolve(httpRequest, request, HttpStatus.CREATED);
    var created = cityService.create(request.toEntity(), requestInfo);

    var location =
        ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(created.getId())
            .toUri();

    return ResponseEntity.created(location).body(CityResponse.from(created));
  }

  @Operation(summary = "Get city by ID")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "City retrieved successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CityResponse.class))),
        @ApiResponse(responseCode = "404", description = "City not found or inactive")
      })
  @GetMapping(path = "/{id}", produces = "application/json")
  public CityResponse getById(
      @PathVariable Long id,
      @Parameter(description = "Also find the city if it is inactive")
          @RequestParam(required = false, defaultValue = "false")
          boolean includeInactive) {
    log.info("Retrieving city id: {} includeInactive: {}", id, includeInactive);

    return CityResponse.from(cityService.getById(id, includeInactive));
  }

  @Operation(
      summary = "List cities",
      description = "List cities in creation order, optionally filtered by state")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array = @ArraySchema(schema = @Schema(implementation = CityResponse.class)))),
        @ApiResponse(responseCode = "400", description = "Invalid skip or limit")
      })
  @GetMapping(produces = "application/json")
  public List<CityResponse> list(
      @Parameter(description = "Only return cities of this state") @RequestParam(required = false)
          Long stateId,
      @Parameter(description = "Number of rows to skip") @RequestParam(required = false)
          Long skip,
      @Parameter(description = "Maximum number of rows to return") @RequestParam(required = false)
          Integer limit,
      @Parameter(description = "Also return inactive cities")
          @RequestParam(required = false, defaultValue = "false")
          boolean includeInactive) {
    log.info(
        "Listing cities stateId: {} skip: {} limit: {} includeInactive: {}",
        stateId,
        skip,
        limit,
        includeInactive);

    var window = paginationResolver.resolve(skip, limit);
    return cityService.list(stateId, window.skip(), window.limit(), includeInactive).stream()
        .map(CityResponse::from)
        .toList();
  }

  @Operation(
      summary = "Update city",
      description =
          "Partially update a city. active=false deactivates it, active=true re-activates it. "
              + "An inactive city can only be addressed with includeInactive=true.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "City updated successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CityResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "City not found or inactive"),
        @ApiResponse(responseCode = "409", description = "An active city already holds the code")
      })
  @PutMapping(path = "/{id}", produces = "application/json", consumes = "application/json")
  public CityResponse update(
      @PathVariable Long id,
      @Valid @RequestBody CityUpdateRequest request,
      @Parameter(description = "Allow addressing an inactive city")
          @RequestParam(required = false, defaultValue = "false")
          boolean includeInactive,
      HttpServletRequest httpRequest) {
    log.info("Updating city id: {} includeInactive: {}", id, includeInactive);

    var requestInfo = requestInfoResolver.resolve(httpRequest, request, HttpStatus.OK);
    var updated = cityService.update(id, request.toUpdate(), includeInactive, requestInfo);
    return CityResponse.from(updated);
  }

  @Operation(summary = "Delete city", description = "Permanently delete a city")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "City deleted, the deleted city is returned",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CityResponse.class))),
        @ApiResponse(responseCode = "404", description = "City not found or inactive")
      })
  @DeleteMapping(path = "/{id}", produces = "application/json")
  public CityResponse delete(
      @PathVariable Long id,
      @Parameter(description = "Allow addressing an inactive city")
          @RequestParam(required = false, defaultValue = "false")
          boolean includeInactive,
      HttpServletRequest httpRequest) {
    log.info("Deleting city id: {} includeInactive: {}", id, includeInactive);

    var requestInfo = requestInfoResolver.resolve(httpRequest, null, HttpStatus.OK);
    return CityResponse.from(cityService.delete(id, includeInactive, requestInfo));
  }
}
