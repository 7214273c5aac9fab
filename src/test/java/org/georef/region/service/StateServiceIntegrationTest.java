package org.georef.region.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import org.georef.region.base.AbstractIntegrationTest;
import org.georef.region.domain.Country;
import org.georef.region.fixture.CityTestBuilder;
import org.georef.region.fixture.CountryTestBuilder;
import org.georef.region.fixture.StateTestBuilder;
import org.georef.region.fixture.TestConstants;
import org.georef.region.service.dto.StateUpdate;
import org.georef.region.service.exception.DuplicateCodeException;
import org.georef.region.service.exception.EntityNotFoundException;
import org.georef.region.service.exception.RestrictedDeletionException;

/** Integration tests for {@link StateService} against PostgreSQL. */
class StateServiceIntegrationTest extends AbstractIntegrationTest {

  @Autowired private CountryService countryService;

  @Autowired private StateService stateService;

  @Autowired private CityService cityService;

  private Country japan;

  @BeforeEach
  void createCountry() {
    japan =
        countryService.create(
            CountryTestBuilder.defaultJapan().build(), TestConstants.REQUEST_INFO);
  }

  @Test
  void createUnderMissingCountryThrowsNotFoundAndWritesNothing() {
    var state = StateTestBuilder.defaultTokyo(TestConstants.NON_EXISTENT_ID).build();

    assertThatThrownBy(() -> stateService.create(state, TestConstants.REQUEST_INFO))
        .isInstanceOf(EntityNotFoundException.class)
        .hasMessage("Country with id " + TestConstants.NON_EXISTENT_ID + " not found");

    assertThat(testDatabaseHelper.countRows("state")).isZero();
    assertThat(testDatabaseHelper.countEvents()).isEqualTo(1);
  }

  @Test
  void createNormalisesCodeAndRejectsDuplicateInAnyCase() {
    var created =
        stateService.create(
            StateTestBuilder.defaultTokyo(japan.getId()).withCode("jp-13").build(),
            TestConstants.REQUEST_INFO);

    assertThat(created.getCode()).isEqualTo(TestConstants.STATE_TOKYO_CODE);
    assertThatThrownBy(
            () ->
                stateService.create(
                    StateTestBuilder.defaultTokyo(japan.getId()).build(),
                    TestConstants.REQUEST_INFO))
        .isInstanceOf(DuplicateCodeException.class)
        .hasMessage("State with code 'JP-13' already exists");
  }

  @Test
  void listFiltersByCountryInInsertionOrder() {
    var us =
        countryService.create(
            CountryTestBuilder.defaultUnitedStates().build(), TestConstants.REQUEST_INFO);
    var tokyo =
        stateService.create(
            StateTestBuilder.defaultTokyo(japan.getId()).build(), TestConstants.REQUEST_INFO);
    stateService.create(
        new StateTestBuilder()
            .withCountryId(us.getId())
            .withName(TestConstants.STATE_CALIFORNIA_NAME)
            .withCode(TestConstants.STATE_CALIFORNIA_CODE)
            .build(),
        TestConstants.REQUEST_INFO);
    var osaka =
        stateService.create(
            StateTestBuilder.defaultOsaka(japan.getId()).build(), TestConstants.REQUEST_INFO);

    var japanese = stateService.list(japan.getId(), 0, 10);

    assertThat(japanese).extracting("id").containsExactly(tokyo.getId(), osaka.getId());
    assertThat(stateService.list(null, 0, 10)).hasSize(3);
  }

  @Test
  void listByMissingCountryThrowsNotFound() {
    assertThatThrownBy(() -> stateService.listByCountry(TestConstants.NON_EXISTENT_ID, 0, 10))
        .isInstanceOf(EntityNotFoundException.class);
  }

  @Test
  void updateMovesStateToAnotherExistingCountry() {
    var us =
        countryService.create(
            CountryTestBuilder.defaultUnitedStates().build(), TestConstants.REQUEST_INFO);
    var tokyo =
        stateService.create(
            StateTestBuilder.defaultTokyo(japan.getId()).build(), TestConstants.REQUEST_INFO);

    var moved =
        stateService.update(
            tokyo.getId(), new StateUpdate(us.getId(), null, null), TestConstants.REQUEST_INFO);

    assertThat(moved.getCountryId()).isEqualTo(us.getId());
    assertThat(stateService.listByCountry(japan.getId(), 0, 10)).isEmpty();
    assertThat(testDatabaseHelper.countEvents("UPDATE", "state", tokyo.getId())).isEqualTo(1);
  }

  @Test
  void updateToMissingCountryThrowsNotFound() {
    var tokyo =
        stateService.create(
            StateTestBuilder.defaultTokyo(japan.getId()).build(), TestConstants.REQUEST_INFO);

    assertThatThrownBy(
            () ->
                stateService.update(
                    tokyo.getId(),
                    new StateUpdate(TestConstants.NON_EXISTENT_ID, null, null),
                    TestConstants.REQUEST_INFO))
        .isInstanceOf(EntityNotFoundException.class);
    assertThat(stateService.getById(tokyo.getId()).getCountryId()).isEqualTo(japan.getId());
  }

  @Test
  void deleteStateWithCitiesIsRestrictedEvenIfAllCitiesAreInactive() {
    var tokyo =
        stateService.create(
            StateTestBuilder.defaultTokyo(japan.getId()).build(), TestConstants.REQUEST_INFO);
    cityService.create(
        CityTestBuilder.defaultMinato(tokyo.getId()).inactive().build(),
        TestConstants.REQUEST_INFO);

    assertThatThrownBy(() -> stateService.delete(tokyo.getId(), TestConstants.REQUEST_INFO))
        .isInstanceOf(RestrictedDeletionException.class)
        .hasMessage(
            "Cannot delete State with id " + tokyo.getId() + ": City records still reference it");
    assertThat(testDatabaseHelper.countEvents("DELETE", "state", tokyo.getId())).isZero();
  }

  @Test
  void deleteStateWithoutCitiesRemovesRowAndRecordsEvent() {
    var tokyo =
        stateService.create(
            StateTestBuilder.defaultTokyo(japan.getId()).build(), TestConstants.REQUEST_INFO);

    var deleted = stateService.delete(tokyo.getId(), TestConstants.REQUEST_INFO);

    assertThat(deleted.getId()).isEqualTo(tokyo.getId());
    assertThat(deleted.getCode()).isEqualTo(TestConstants.STATE_TOKYO_CODE);
    assertThat(testDatabaseHelper.countRows("state")).isZero();
    assertThat(testDatabaseHelper.countEvents("DELETE", "state", tokyo.getId())).isEqualTo(1);
    assertThatThrownBy(() -> stateService.getById(tokyo.getId()))
        .isInstanceOf(EntityNotFoundException.class);
  }
}
