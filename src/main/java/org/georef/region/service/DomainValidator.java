package org.georef.region.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import org.georef.region.domain.EntityType;
import org.georef.region.repository.CityRepository;
import org.georef.region.repository.CountryRepository;
import org.georef.region.repository.StateRepository;
import org.georef.region.service.exception.DuplicateCodeException;
import org.georef.region.service.exception.EntityNotFoundException;

/**
 * Pre-write checks run by the write services before any row is touched.
 *
 * <p>Checks read committed state inside the caller's transaction. They give precise error messages
 * for the expected conflicts, but two concurrent writers can both pass them; the unique
 * constraints and the partial unique index on {@code city} remain the final authority (see
 * {@link IntegrityViolationTranslator}).
 */
@Component
public class DomainValidator {

  private static final Logger log = LoggerFactory.getLogger(DomainValidator.class);

  /** Entity label used in duplicate-code errors for the active-only city scope. */
  public static final String ACTIVE_CITY = "Active city";

  private final CountryRepository countryRepository;
  private final StateRepository stateRepository;
  private final CityRepository cityRepository;

  public DomainValidator(
      CountryRepository countryRepository,
      StateRepository stateRepository,
      CityRepository cityRepository) {
    this.countryRepository = countryRepository;
    this.stateRepository = stateRepository;
    this.cityRepository = cityRepository;
  }

  /**
   * Validate that a parent row exists.
   *
   * @param parentType Type of the parent (Country for states, State for cities)
   * @param parentId ID of the parent
   * @throws EntityNotFoundException if no row with that id exists
   */
  public void validateParentExists(EntityType parentType, Long parentId) {
    boolean exists =
        switch (parentType) {
          case COUNTRY -> countryRepository.existsById(parentId);
          case STATE -> stateRepository.existsById(parentId);
          case CITY -> cityRepository.existsById(parentId);
        };

    if (!exists) {
      log.debug("Rejected write: {} {} does not exist", parentType.displayName(), parentId);
      throw new EntityNotFoundException(parentType.displayName(), parentId);
    }
  }

  /**
   * Validate that a country or state code is globally unique.
   *
   * @param entityType COUNTRY or STATE
   * @param code Upper-case code to check
   * @param excludeId Row to ignore when checking an update in place, or null
   * @throws DuplicateCodeException if another row holds the code
   * @throws IllegalArgumentException for CITY, whose codes are scoped to active rows
   */
  public void validateCodeUnique(EntityType entityType, String code, Long excludeId) {
    boolean taken =
        switch (entityType) {
          case COUNTRY ->
              excludeId == null
                  ? countryRepository.existsByCode(code)
                  : countryRepository.existsByCodeAndIdNot(code, excludeId);
          case STATE ->
              excludeId == null
                  ? stateRepository.existsByCode(code)
                  : stateRepository.existsByCodeAndIdNot(code, excludeId);
          case CITY ->
              throw new IllegalArgumentException(
                  "City codes are unique among active cities only; "
                      + "use validateActiveCityCodeUnique");
        };

    if (taken) {
      log.debug("Rejected write: {} code '{}' already exists", entityType.displayName(), code);
      throw new DuplicateCodeException(entityType.displayName(), code);
    }
  }

  /**
   * Validate that no other active city holds a code. Inactive cities are never considered.
   *
   * @param code Six-digit city code
   * @param excludeId City to ignore when checking an update in place, or null
   * @throws DuplicateCodeException if an active city other than excludeId holds the code
   */
  public void validateActiveCityCodeUnique(String code, Long excludeId) {
    boolean taken =
        excludeId == null
            ? cityRepository.existsByCodeAndActiveTrue(code)
            : cityRepository.existsByCodeAndActiveTrueAndIdNot(code, excludeId);

    if (taken) {
      log.debug("Rejected write: active city code '{}' already exists", code);
      throw new DuplicateCodeException(ACTIVE_CITY, code);
    }
  }
}
