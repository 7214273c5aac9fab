package org.georef.region.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;

import org.georef.region.base.AbstractControllerTest;
import org.georef.region.fixture.TestConstants;
import org.georef.region.web.CorrelationIdFilter;

/**
 * Integration tests for {@link CountryController}.
 *
 * <p>Covers the HTTP contract (status codes, Location header, error bodies) and the request
 * metadata that ends up in the event log.
 */
class CountryControllerTest extends AbstractControllerTest {

  private static final String COUNTRIES = "/v1/countries";

  private static final String JAPAN_JSON =
      """
      {"name": "Japan", "code": "JP"}
      """;

  @Autowired private JdbcTemplate jdbcTemplate;

  // ===========================================================================================
  // Create
  // ===========================================================================================

  @Test
  void createReturns201WithLocationAndBody() throws Exception {
    performPost(COUNTRIES, JAPAN_JSON)
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", endsWith(COUNTRIES + "/" + lastCountryId())))
        .andExpect(jsonPath("$.name").value(TestConstants.COUNTRY_JAPAN_NAME))
        .andExpect(jsonPath("$.code").value(TestConstants.COUNTRY_JAPAN_CODE));
  }

  @Test
  void createNormalisesCodeToUpperCase() throws Exception {
    performPost(COUNTRIES, """
        {"name": "Japan", "code": "jp"}
        """)
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.code").value("JP"));
  }

  @Test
  void createStoresRequestMetadataInEventLog() throws Exception {
    mockMvc
        .perform(
            post(COUNTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content(JAPAN_JSON)
                .header(RequestInfoResolver.USER_ID_HEADER, TestConstants.TEST_USER_ID)
                .header(
                    RequestInfoResolver.FORWARDED_FOR_HEADER,
                    TestConstants.TEST_IP_ADDRESS + ", 10.0.0.1"))
        .andExpect(status().isCreated());

    var event =
        jdbcTemplate.queryForMap(
            "SELECT event_type, entity_type, request_method, request_path, request_body,"
                + " user_id, ip_address, status_code FROM event_log");
    assertThat(event)
        .containsEntry("event_type", "CREATE")
        .containsEntry("entity_type", "country")
        .containsEntry("request_method", "POST")
        .containsEntry("request_path", COUNTRIES)
        .containsEntry("user_id", TestConstants.TEST_USER_ID)
        .containsEntry("ip_address", TestConstants.TEST_IP_ADDRESS)
        .containsEntry("status_code", 201);
    assertThat((String) event.get("request_body"))
        .isEqualTo("{\"name\":\"Japan\",\"code\":\"JP\"}");
  }

  @Test
  void createWithOversizedUserIdReturns400AndWritesNothing() throws Exception {
    mockMvc
        .perform(
            post(COUNTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content(JAPAN_JSON)
                .header(RequestInfoResolver.USER_ID_HEADER, "u".repeat(101)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("INVALID_REQUEST"))
        .andExpect(jsonPath("$.message").value("X-User-Id header must not exceed 100 characters"));

    assertThat(testDatabaseHelper.countRows("country")).isZero();
    assertThat(testDatabaseHelper.countEvents()).isZero();
  }

  @Test
  void updateWithBlankNameReturns400() throws Exception {
    var id = createAndGetId(COUNTRIES, JAPAN_JSON);

    performPut(COUNTRIES + "/" + id, """
        {"name": "   "}
        """)
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("name: Name must not be blank"));

    assertThat(testDatabaseHelper.countEvents("UPDATE", "country", id)).isZero();
  }

  @Test
  void createWithDuplicateCodeReturns409() throws Exception {
    createAndGetId(COUNTRIES, JAPAN_JSON);

    performPost(COUNTRIES, """
        {"name": "Nippon", "code": "jp"}
        """)
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.type").value("APPLICATION_ERROR"))
        .andExpect(jsonPath("$.code").value("DUPLICATE_CODE"))
        .andExpect(jsonPath("$.message").value("Country with code 'JP' already exists"));

    assertThat(testDatabaseHelper.countEvents()).isEqualTo(1);
  }

  @Test
  void createWithInvalidCodeReturns400() throws Exception {
    performPost(COUNTRIES, """
        {"name": "Japan", "code": "JPN"}
        """)
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("INVALID_REQUEST"));

    assertThat(testDatabaseHelper.countEvents()).isZero();
  }

  @Test
  void createWithUnknownFieldReturns400() throws Exception {
    performPost(COUNTRIES, """
        {"name": "Japan", "code": "JP", "population": 125000000}
        """)
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("INVALID_REQUEST"));
  }

  // ===========================================================================================
  // Read
  // ===========================================================================================

  @Test
  void getMissingCountryReturns404() throws Exception {
    performGet(COUNTRIES + "/{id}", TestConstants.NON_EXISTENT_ID)
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("NOT_FOUND"))
        .andExpect(jsonPath("$.code").value("ENTITY_NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("Country with id 999999 not found"));
  }

  @Test
  void listAppliesSkipAndLimit() throws Exception {
    createAndGetId(COUNTRIES, JAPAN_JSON);
    var us = createAndGetId(COUNTRIES, """
        {"name": "United States", "code": "US"}
        """);

    performGet(COUNTRIES + "?skip=1&limit=5")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].id").value(us));
  }

  @Test
  void listWithLimitAboveMaximumReturns400() throws Exception {
    performGet(COUNTRIES + "?limit=1001")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("limit must be between 1 and 1000"));
  }

  @Test
  void listWithSkipBeyondIntRangeReturns400() throws Exception {
    performGet(COUNTRIES + "?skip=3000000000")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("INVALID_REQUEST"))
        .andExpect(jsonPath("$.message").value("skip must not exceed 2147483647"));
  }

  @Test
  void listWithNonNumericSkipReturns400() throws Exception {
    performGet(COUNTRIES + "?skip=abc")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid value for parameter 'skip'"));
  }

  @Test
  void listStatesOfMissingCountryReturns404() throws Exception {
    performGet(COUNTRIES + "/{id}/states", TestConstants.NON_EXISTENT_ID)
        .andExpect(status().isNotFound());
  }

  // ===========================================================================================
  // Update
  // ===========================================================================================

  @Test
  void updateStoresOnlyChangedFieldsInEventBody() throws Exception {
    var id = createAndGetId(COUNTRIES, JAPAN_JSON);

    performPut(COUNTRIES + "/" + id, """
        {"name": "Nippon"}
        """)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Nippon"))
        .andExpect(jsonPath("$.code").value("JP"));

    var body =
        jdbcTemplate.queryForObject(
            "SELECT request_body FROM event_log WHERE event_type = 'UPDATE'", String.class);
    assertThat(body).isEqualTo("{\"name\":\"Nippon\"}");
  }

  // ===========================================================================================
  // Delete
  // ===========================================================================================

  @Test
  void deleteReturnsDeletedCountryAndRecordsEventWithoutBody() throws Exception {
    var id = createAndGetId(COUNTRIES, JAPAN_JSON);

    performDelete(COUNTRIES + "/{id}", id)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(id));

    var event =
        jdbcTemplate.queryForMap(
            "SELECT request_body, status_code FROM event_log WHERE event_type = 'DELETE'");
    assertThat(event.get("request_body")).isNull();
    assertThat(event).containsEntry("status_code", 200);
    assertThat(testDatabaseHelper.countRows("country")).isZero();
  }

  @Test
  void deleteCountryWithStatesReturns400() throws Exception {
    var id = createAndGetId(COUNTRIES, JAPAN_JSON);
    createAndGetId(
        "/v1/states", "{\"countryId\": " + id + ", \"name\": \"Tokyo\", \"code\": \"JP-13\"}");

    performDelete(COUNTRIES + "/{id}", id)
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("APPLICATION_ERROR"))
        .andExpect(jsonPath("$.code").value("RESTRICTED_DELETION"));

    assertThat(testDatabaseHelper.countEvents("DELETE", "country", id)).isZero();
  }

  // ===========================================================================================
  // Correlation ID
  // ===========================================================================================

  @Test
  void correlationIdIsEchoed() throws Exception {
    mockMvc
        .perform(
            delete(COUNTRIES + "/{id}", TestConstants.NON_EXISTENT_ID)
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "abc-123"))
        .andExpect(status().isNotFound())
        .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "abc-123"));
  }

  private Long lastCountryId() {
    return jdbcTemplate.queryForObject("SELECT MAX(id) FROM country", Long.class);
  }
}
