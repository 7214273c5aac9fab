package org.georef.region.repository;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import org.georef.region.domain.State;

/** Repository for managing State entities. */
public interface StateRepository extends JpaRepository<State, Long> {

  boolean existsByCode(String code);

  boolean existsByCodeAndIdNot(String code, Long id);

  /**
   * Check whether any state still references a country.
   *
   * @param countryId The country ID
   * @return true if at least one state belongs to the country
   */
  boolean existsByCountryId(Long countryId);

  /**
   * Find a window of states belonging to a country.
   *
   * @param countryId The country ID
   * @param pageable Offset, limit and ordering of the window
   * @return States of the country within the window
   */
  List<State> findByCountryId(Long countryId, Pageable pageable);
}
