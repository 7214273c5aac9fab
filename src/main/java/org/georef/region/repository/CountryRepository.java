package org.georef.region.repository;

import org.springframework.data.jpa.repository.JpaRepository;

import org.georef.region.domain.Country;

/** Repository for managing Country entities. */
public interface CountryRepository extends JpaRepository<Country, Long> {

  /**
   * Check whether a country other than {@code id} already uses a code.
   *
   * @param code The upper-case country code
   * @param id The country to ignore
   * @return true if another country holds the code
   */
  boolean existsByCodeAndIdNot(String code, Long id);

  boolean existsByCode(String code);
}
