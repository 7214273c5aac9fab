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

import org.georef.region.api.request.CountryCreateRequest;
import org.georef.region.api.request.CountryUpdateRequest;
import org.georef.region.api.response.ApiErrorResponse;
import org.georef.region.api.response.CountryResponse;
import org.georef.region.api.response.StateResponse;
import org.georef.region.service.CountryService;
import org.georef.region.service.StateService;

/** Endpoints for managing countries. */
@Tag(
    name = "Country Handler",
    description = "Endpoints for creating, querying and deleting countries")
@RestController
@RequestMapping(path = "/v1/countries")
public class CountryController {

  private static final Logger log = LoggerFactory.getLogger(CountryController.class);

  private final CountryService countryService;
  private final StateService stateService;
  private final RequestInfoResolver requestInfoResolver;
  private final PaginationResolver paginationResolver;

  public CountryController(
      CountryService countryService,
      StateService stateService,
      RequestInfoResolver requestInfoResolver,
      PaginationResolver paginationResolver) {
    this.countryService = countryService;
    this.stateService = stateService;
    this.requestInfoResolver = requestInfoResolver;
    this.paginationResolver = paginationResolver;
  }

  @Operation(
      summary = "Create a new country",
      description = "Create a country. The code is stored upper-cased and must be unique.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "201",
            description = "Country created successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CountryResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "409",
            description = "Country code already exists",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples =
                        @ExampleObject(
                            name = "Duplicate Country Code",
                            value =
                                """
                                {
                                  "type": "APPLICATION_ERROR",
                                  "message": "Country with code 'JP' already exists",
                                  "code": "DUPLICATE_CODE"
                                }
                                """)))
      })
  @PostMapping(produces = "application/json", consumes = "application/json")
  @ResponseStatus(HttpStatus.CREATED)
  public ResponseEntity<CountryResponse> create(
      @Valid @RequestBody CountryCreateRequest request, HttpServletRequest httpRequest) {
    log.info("Creating country code: {}", request.code());

    var requestInfo = requestInfoResolver.resolve(httpRequest, request, HttpStatus.CREATED);
    var created = countryService.create(request.toEntity(), requestInfo);

    var location =
        ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(created.getId())
            .toUri();

    return ResponseEntity.created(location).body(CountryResponse.from(created));
  }

  @Operation(summary = "Get country by ID")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Country retrieved successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CountryResponse.class))),
        @ApiResponse(responseCode = "404", description = "Country not found")
      })
  @GetMapping(path = "/{id}", produces = "application/json")
  public CountryResponse getById(@PathVariable Long id) {
    log.info("Retrieving country id: {}", id);

    return CountryResponse.from(countryService.getById(id));
  }

  @Operation(summary = "List countries", description = "List countries in creation order")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(
                            schema = @Schema(implementation = CountryResponse.class)))),
        @ApiResponse(responseCode = "400", description = "Invalid skip or limit")
      })
  @GetMapping(produces = "application/json")
  public List<CountryResponse> list(
      @Parameter(description = "Number of rows to skip") @RequestParam(required = false)
          Long skip,
      @Parameter(description = "Maximum number of rows to return") @RequestParam(required = false)
          Integer limit) {
    log.info("Listing countries skip: {} limit: {}", skip, limit);

    var window = paginationResolver.resolve(skip, limit);
    return countryService.list(window.skip(), window.limit()).stream()
        .map(CountryResponse::from)
        .toList();
  }

  @Operation(
      summary = "Update country",
      description = "Partially update a country. Omitted fields are left unchanged.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Country updated successfully",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CountryResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(responseCode = "404", description = "Country not found"),
        @ApiResponse(responseCode = "409", description = "Country code already exists")
      })
  @PutMapping(path = "/{id}", produces = "application/json", consumes = "application/json")
  public CountryResponse update(
      @PathVariable Long id,
      @Valid @RequestBody CountryUpdateRequest request,
      HttpServletRequest httpRequest) {
    log.info("Updating country id: {}", id);

    var requestInfo = requestInfoResolver.resolve(httpRequest, request, HttpStatus.OK);
    return CountryResponse.from(countryService.update(id, request.toUpdate(), requestInfo));
  }

  @Operation(
      summary = "Delete country",
      description = "Delete a country. Refused while any state belongs to it.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Country deleted, the deleted country is returned",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CountryResponse.class))),
        @ApiResponse(responseCode = "400", description = "States still reference the country"),
        @ApiResponse(responseCode = "404", description = "Country not found")
      })
  @DeleteMapping(path = "/{id}", produces = "application/json")
  public CountryResponse delete(@PathVariable Long id, HttpServletRequest httpRequest) {
    log.info("Deleting country id: {}", id);

    var requestInfo = requestInfoResolver.resolve(httpRequest, null, HttpStatus.OK);
    return CountryResponse.from(countryService.delete(id, requestInfo));
  }

  @Operation(summary = "List states of a country")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array = @ArraySchema(schema = @Schema(implementation = StateResponse.class)))),
        @ApiResponse(responseCode = "404", description = "Country not found")
      })
  @GetMapping(path = "/{id}/states", produces = "application/json")
  public List<StateResponse> listStates(
      @PathVariable Long id,
      @Parameter(description = "Number of rows to skip") @RequestParam(required = false)
          Long skip,
      @Parameter(description = "Maximum number of rows to return") @RequestParam(required = false)
          Integer limit) {
    log.info("Listing states of country id: {}", id);

    var window = paginationResolver.resolve(skip, limit);
    return stateService.listByCountry(id, window.skip(), window.limit()).stream()
        .map(StateResponse::from)
        .toList();
  }
}
