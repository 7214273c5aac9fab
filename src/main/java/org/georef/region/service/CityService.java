package org.georef.region.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.georef.region.domain.City;
import org.georef.region.domain.EntityType;
import org.georef.region.domain.EventType;
import org.georef.region.domain.RequestInfo;
import org.georef.region.repository.CityRepository;
import org.georef.region.repository.OffsetPageRequest;
import org.georef.region.repository.StateRepository;
import org.georef.region.repository.spec.CitySpecifications;
import org.georef.region.service.dto.CityUpdate;
import org.georef.region.service.exception.DuplicateCodeException;
import org.georef.region.service.exception.EntityNotFoundException;

/**
 * Service for managing cities.
 *
 * <p>Cities have two independent lifecycle axes. Existence is changed by create and delete;
 * activity is changed by update ({@code active=false} deactivates, {@code active=true}
 * re-activates). Lookups hide inactive cities unless the caller passes {@code includeInactive}.
 *
 * <p>City codes are unique among active cities only. An inactive city never blocks a code, so a
 * municipality that was merged or abolished can hand its code to a successor.
 */
@Service
public class CityService {

  private static final Logger log = LoggerFactory.getLogger(CityService.class);

  private final CityRepository cityRepository;
  private final StateRepository stateRepository;
  private final DomainValidator domainValidator;
  private final EventLogRecorder eventLogRecorder;
  private final IntegrityViolationTranslator violationTranslator;

  public CityService(
      CityRepository cityRepository,
      StateRepository stateRepository,
      DomainValidator domainValidator,
      EventLogRecorder eventLogRecorder,
      IntegrityViolationTranslator violationTranslator) {
    this.cityRepository = cityRepository;
    this.stateRepository = stateRepository;
    this.domainValidator = domainValidator;
    this.eventLogRecorder = eventLogRecorder;
    this.violationTranslator = violationTranslator;
  }

  /**
   * Create a new city and record a CREATE event.
   *
   * <p>The code check only applies when the new city is active: an inactive city may reuse the
   * code of an active one.
   *
   * @param city The city to create (stateId, name, code, active)
   * @param requestInfo Request metadata for the event log
   * @return The created city with database-generated ID
   * @throws EntityNotFoundException if the parent state does not exist
   * @throws DuplicateCodeException if the city is active and another active city holds the code
   */
  @Transactional
  public City create(City city, RequestInfo requestInfo) {
    domainValidator.validateParentExists(EntityType.STATE, city.getStateId());
    if (city.isActive()) {
      domainValidator.validateActiveCityCodeUnique(city.getCode(), null);
    }

    City saved;
    try {
      saved = cityRepository.saveAndFlush(city);
    } catch (DataIntegrityViolationException e) {
      throw violationTranslator.translateWrite(e, EntityType.CITY, null, city.getCode());
    }

    eventLogRecorder.record(EventType.CREATE, EntityType.CITY, saved.getId(), requestInfo);

    log.info(
        "Created city id: {} code: {} state id: {} active: {}",
        saved.getId(),
        saved.getCode(),
        saved.getStateId(),
        saved.isActive());
    return saved;
  }

  /**
   * Get a city by ID.
   *
   * @param id The city ID
   * @param includeInactive If false, an inactive city is reported as not found
   * @return The city
   * @throws EntityNotFoundException if the city does not exist or is hidden as inactive
   */
  @Transactional(readOnly = true)
  public City getById(Long id, boolean includeInactive) {
    var city =
        includeInactive ? cityRepository.findById(id) : cityRepository.findByIdAndActiveTrue(id);
    return city.orElseThrow(() -> new EntityNotFoundException(EntityType.CITY.displayName(), id));
  }

  /**
   * List cities in insertion order.
   *
   * @param stateId State to filter by, or null for all cities
   * @param skip Number of rows to skip
   * @param limit Maximum number of rows to return
   * @param includeInactive If false, only active cities are returned
   * @return Cities within the window
   */
  @Transactional(readOnly = true)
  public List<City> list(Long stateId, long skip, int limit, boolean includeInactive) {
    var spec = buildSpecification(stateId, includeInactive);
    return cityRepository.findAll(spec, OffsetPageRequest.of(skip, limit)).getContent();
  }

  /**
   * List the cities of a state that must exist.
   *
   * @param stateId The state ID
   * @param skip Number of rows to skip
   * @param limit Maximum number of rows to return
   * @param includeInactive If false, only active cities are returned
   * @return Cities of the state within the window
   * @throws EntityNotFoundException if the state does not exist
   */
  @Transactional(readOnly = true)
  public List<City> listByState(Long stateId, long skip, int limit, boolean includeInactive) {
    if (!stateRepository.existsById(stateId)) {
      throw new EntityNotFoundException(EntityType.STATE.displayName(), stateId);
    }
    return list(stateId, skip, limit, includeInactive);
  }

  /**
   * Partially update a city and record an UPDATE event.
   *
   * <p>The active-code check runs whenever the city will be active afterwards and either its code
   * changes or it is being re-activated. Re-activating a city whose code has since been taken by
   * another active city is rejected with a duplicate-code error.
   *
   * @param id The city ID
   * @param update Fields to change
   * @param includeInactive If false, an inactive city cannot be addressed
   * @param requestInfo Request metadata for the event log
   * @return The updated city
   * @throws EntityNotFoundException if the city does not exist or is hidden as inactive
   * @throws DuplicateCodeException if the result would clash with another active city
   */
  @Transactional
  public City update(Long id, CityUpdate update, boolean includeInactive, RequestInfo requestInfo) {
    var city = getById(id, includeInactive);

    var resultingCode = update.code() != null ? update.code() : city.getCode();
    var resultingActive = update.active() != null ? update.active() : city.isActive();
    var codeChanges = !resultingCode.equals(city.getCode());
    var reactivates = resultingActive && !city.isActive();
    if (resultingActive && (codeChanges || reactivates)) {
      domainValidator.validateActiveCityCodeUnique(resultingCode, id);
    }

    if (update.name() != null) {
      city.setName(update.name());
    }
    city.setCode(resultingCode);
    city.setActive(resultingActive);

    City saved;
    try {
      saved = cityRepository.saveAndFlush(city);
    } catch (DataIntegrityViolationException e) {
      throw violationTranslator.translateWrite(e, EntityType.CITY, id, resultingCode);
    }

    eventLogRecorder.record(EventType.UPDATE, EntityType.CITY, saved.getId(), requestInfo);

    log.info("Updated city id: {} active: {}", saved.getId(), saved.isActive());
    return saved;
  }

  /**
   * Delete a city and record a DELETE event.
   *
   * <p>This removes the row. Deactivation is a separate update.
   *
   * @param id The city ID
   * @param includeInactive If false, an inactive city cannot be addressed
   * @param requestInfo Request metadata for the event log
   * @return The deleted city
   * @throws EntityNotFoundException if the city does not exist or is hidden as inactive
   */
  @Transactional
  public City delete(Long id, boolean includeInactive, RequestInfo requestInfo) {
    var city = getById(id, includeInactive);

    // nothing references cities yet, so a violation here can only be unexpected
    try {
      cityRepository.delete(city);
      cityRepository.flush();
    } catch (DataIntegrityViolationException e) {
      throw violationTranslator.translateWrite(e, EntityType.CITY, id, city.getCode());
    }

    eventLogRecorder.record(EventType.DELETE, EntityType.CITY, id, requestInfo);

    log.info("Deleted city id: {} code: {}", id, city.getCode());
    return city;
  }

  private Specification<City> buildSpecification(Long stateId, boolean includeInactive) {
    var rv = CitySpecifications.all();

    if (stateId != null) {
      rv = rv.and(CitySpecifications.belongsToState(stateId));
    }

    if (!includeInactive) {
      rv = rv.and(CitySpecifications.isActive());
    }

    return rv;
  }
}
