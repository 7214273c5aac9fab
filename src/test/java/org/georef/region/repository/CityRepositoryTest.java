package org.georef.region.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

import org.georef.region.base.AbstractRepositoryTest;
import org.georef.region.domain.State;
import org.georef.region.fixture.CityTestBuilder;
import org.georef.region.fixture.CountryTestBuilder;
import org.georef.region.fixture.StateTestBuilder;
import org.georef.region.repository.spec.CitySpecifications;

/**
 * Repository tests for {@link CityRepository}.
 *
 * <p>Tests validate the schema the service relies on:
 *
 * <ul>
 *   <li>Partial unique index: codes are unique among active rows only
 *   <li>Active-only finders and specifications
 *   <li>ON DELETE RESTRICT from city to state
 * </ul>
 */
class CityRepositoryTest extends AbstractRepositoryTest {

  @Autowired private CountryRepository countryRepository;

  @Autowired private StateRepository stateRepository;

  @Autowired private CityRepository cityRepository;

  private State tokyo;

  @BeforeEach
  void setUp() {
    var japan = countryRepository.saveAndFlush(CountryTestBuilder.defaultJapan().build());
    tokyo = stateRepository.saveAndFlush(StateTestBuilder.defaultTokyo(japan.getId()).build());
  }

  // ===========================================================================================
  // Partial unique index ux_city_code_active
  // ===========================================================================================

  @Test
  void twoActiveCitiesWithSameCodeViolateIndex() {
    cityRepository.saveAndFlush(CityTestBuilder.defaultMinato(tokyo.getId()).build());

    assertThatThrownBy(
            () ->
                cityRepository.saveAndFlush(CityTestBuilder.defaultMinato(tokyo.getId()).build()))
        .isInstanceOf(DataIntegrityViolationException.class)
        .hasMessageContaining("ux_city_code_active");
  }

  @Test
  void activeAndInactiveCitiesMayShareCode() {
    cityRepository.saveAndFlush(CityTestBuilder.defaultMinato(tokyo.getId()).build());
    cityRepository.saveAndFlush(CityTestBuilder.defaultMinato(tokyo.getId()).inactive().build());
    cityRepository.saveAndFlush(CityTestBuilder.defaultMinato(tokyo.getId()).inactive().build());

    assertThat(cityRepository.count()).isEqualTo(3);
  }

  // ===========================================================================================
  // Active-only queries
  // ===========================================================================================

  @Test
  void existsByCodeAndActiveTrueIgnoresInactiveCities() {
    cityRepository.saveAndFlush(CityTestBuilder.defaultMinato(tokyo.getId()).inactive().build());

    assertThat(cityRepository.existsByCodeAndActiveTrue("131032")).isFalse();
  }

  @Test
  void existsByCodeAndActiveTrueAndIdNotExcludesOwnRow() {
    var minato = cityRepository.saveAndFlush(CityTestBuilder.defaultMinato(tokyo.getId()).build());

    assertThat(cityRepository.existsByCodeAndActiveTrueAndIdNot("131032", minato.getId()))
        .isFalse();
    assertThat(cityRepository.existsByCodeAndActiveTrueAndIdNot("131032", minato.getId() + 1))
        .isTrue();
  }

  @Test
  void findByIdAndActiveTrueHidesInactiveCity() {
    var inactive =
        cityRepository.saveAndFlush(
            CityTestBuilder.defaultMinato(tokyo.getId()).inactive().build());

    assertThat(cityRepository.findByIdAndActiveTrue(inactive.getId())).isEmpty();
    assertThat(cityRepository.findById(inactive.getId())).isPresent();
  }

  @Test
  void specificationsCombineStateAndActivityFilters() {
    var chiyoda =
        cityRepository.saveAndFlush(CityTestBuilder.defaultChiyoda(tokyo.getId()).build());
    cityRepository.saveAndFlush(CityTestBuilder.defaultMinato(tokyo.getId()).inactive().build());

    var spec =
        CitySpecifications.all()
            .and(CitySpecifications.belongsToState(tokyo.getId()))
            .and(CitySpecifications.isActive());
    var page = cityRepository.findAll(spec, OffsetPageRequest.of(0, 10));

    assertThat(page.getContent()).extracting("id").containsExactly(chiyoda.getId());
  }

  // ===========================================================================================
  // Foreign keys
  // ===========================================================================================

  @Test
  void deletingStateReferencedByCityViolatesForeignKey() {
    cityRepository.saveAndFlush(CityTestBuilder.defaultMinato(tokyo.getId()).inactive().build());

    assertThatThrownBy(
            () -> {
              stateRepository.delete(tokyo);
              stateRepository.flush();
            })
        .isInstanceOf(DataIntegrityViolationException.class)
        .hasMessageContaining("fk_city_state");
  }
}
