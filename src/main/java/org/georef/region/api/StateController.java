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
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.georef.region.api.request.StateCreateRequest;
import org.georef.region.api.request.StateUpdateRequest;
import org.georef.region.api.response.CityResponse;
import org.georef.region.api.response.StateResponse;
import org.georef.region.service.CityService;
import org.georef.region.service.StateService;

/** Endpoints for managing states and provinces. */
@Tag(name = "State Handler", description = "Endpoints for creating, querying and deleting states")
@RestController
@RequestMapping(path = "/v1/states")
public class StateController {

  private static final Logger log = LoggerFactory.getLogger(StateController.class);

  private final StateService stateService;
  private final CityService cityService;
  private final RequestInfoResolver requestInfoResolver;
  private final PaginationResolver paginationResolver;

  public StateController(
      StateService stateService,
      CityService cityService,
      RequestInfoResolver requestInfoResolver,
      PaginationResolver paginationResolver) {
    this.stateService = stateService;
    this.cityService = cityService;
    this.requestInfoResolver = requestInfoResolver;
    this.paginationResolver = paginationResolver;
  }

  @Operation(
      summary = "Create a new state",
      description =
          "Create a state/province under an existing country. The ISO 3166-2 code is stored "
              + "upper-cased and must be unique.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "201",
            description = "State created successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = StateResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "Country not found"),
        @ApiResponse(responseCode = "409", description = "State code already exists")
      })
  @PostMapping(produces = "application/json", consumes = "application/json")
  @ResponseStatus(HttpStatus.CREATED)
  public ResponseEntity<StateResponse> create(
      @Valid @RequestBody StateCreateRequest request, HttpServletRequest httpRequest) {
    log.info("Creating state code: {} for country id: {}", request.code(), request.countryId());

    var requestInfo = requestInfoResolver.resolve(httpRequest, request, HttpStatus.CREATED);
    var created = stateService.create(request.toEntity(), requestInfo);

    var location =
        ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(created.getId())
            .toUri();

    return ResponseEntity.created(location).body(StateResponse.from(created));
  }

  @Operation(summary = "Get state by ID")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "State retrieved successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = StateResponse.class))),
        @ApiResponse(responseCode = "404", description = "State not found")
      })
  @GetMapping(path = "/{id}", produces = "application/json")
  public StateResponse getById(@PathVariable Long id) {
    log.info("Retrieving state id: {}", id);

    return StateResponse.from(stateService.getById(id));
  }

  @Operation(
      summary = "List states",
      description = "List states in creation order, optionally filtered by country")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array = @ArraySchema(schema = @Schema(implementation = StateResponse.class)))),
        @ApiResponse(responseCode = "400", description = "Invalid skip or limit")
      })
  @GetMapping(produces = "application/json")
  public List<StateResponse> list(
      @Parameter(description = "Only return states of this country") @RequestParam(required = false)
          Long countryId,
      @Parameter(description = "Number of rows to skip") @RequestParam(required = false)
          Long skip,
      @Parameter(description = "Maximum number of rows to return") @RequestParam(required = false)
          Integer limit) {
    log.info("Listing states countryId: {} skip: {} limit: {}", countryId, skip, limit);

    var window = paginationResolver.resolve(skip, limit);
    return stateService.list(countryId, window.skip(), window.limit()).stream()
        .map(StateResponse::from)
        .toList();
  }

  @Operation(
      summary = "Update state",
      description =
          "Partially update a state. Omitted fields are left unchanged; a new country ID moves "
              + "the state.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "State updated successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = StateResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "State or new country not found"),
        @ApiResponse(responseCode = "409", description = "State code already exists")
      })
  @PutMapping(path = "/{id}", produces = "application/json", consumes = "application/json")
  public StateResponse update(
      @PathVariable Long id,
      @Valid @RequestBody StateUpdateRequest request,
      HttpServletRequest httpRequest) {
    log.info("Updating state id: {}", id);

    var requestInfo = requestInfoResolver.resolve(httpRequest, request, HttpStatus.OK);
    return StateResponse.from(stateService.update(id, request.toUpdate(), requestInfo));
  }

  @Operation(
      summary = "Delete state",
      description = "Delete a state. Refused while any city belongs to it.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "State deleted, the deleted state is returned",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = StateResponse.class))),
        @ApiResponse(responseCode = "400", description = "Cities still reference the state"),
        @ApiResponse(responseCode = "404", description = "State not found")
      })
  @DeleteMapping(path = "/{id}", produces = "application/json")
  public StateResponse delete(@PathVariable Long id, HttpServletRequest httpRequest) {
    log.info("Deleting state id: {}", id);

    var requestInfo = requestInfoResolver.resolve(httpRequest, null, HttpStatus.OK);
    return StateResponse.from(stateService.delete(id, requestInfo));
  }

  @Operation(summary = "List cities of a state")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array = @ArraySchema(schema = @Schema(implementation = CityResponse.class)))),
        @ApiResponse(responseCode = "404", description = "State not found")
      })
  @GetMapping(path = "/{id}/cities", produces = "application/json")
  public List<CityResponse> listCities(
      @PathVariable Long id,
      @Parameter(description = "Number of rows to skip") @RequestParam(required = false)
          Long skip,
      @Parameter(description = "Maximum number of rows to return") @RequestParam(required = false)
          Integer limit,
      @Parameter(description = "Also return inactive cities")
          @RequestParam(required = false, defaultValue = "false")
          boolean includeInactive) {
    log.info("Listing cities of state id: {} includeInactive: {}", id, includeInactive);

    var window = paginationResolver.resolve(skip, limit);
    return cityService.listByState(id, window.skip(), window.limit(), includeInactive).stream()
        .map(CityResponse::from)
        .toList();
  }
}
