package org.georef.region.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import org.georef.region.domain.City;

/** Repository for managing City entities. */
public interface CityRepository extends JpaRepository<City, Long>, JpaSpecificationExecutor<City> {

  /**
   * Find a city by ID only if it is active.
   *
   * @param id The city ID
   * @return Optional containing the city if it exists and is active
   */
  Optional<City> findByIdAndActiveTrue(Long id);

  /**
   * Check whether an active city already uses a code. Inactive cities are ignored.
   *
   * @param code The six-digit city code
   * @return true if an active city holds the code
   */
  boolean existsByCodeAndActiveTrue(String code);

  boolean existsByCodeAndActiveTrueAndIdNot(String code, Long id);

  boolean existsByStateId(Long stateId);
}
