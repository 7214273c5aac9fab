package org.georef.region.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.georef.region.domain.EntityType;
import org.georef.region.domain.EventType;
import org.georef.region.domain.RequestInfo;
import org.georef.region.domain.State;
import org.georef.region.repository.CityRepository;
import org.georef.region.repository.CountryRepository;
import org.georef.region.repository.OffsetPageRequest;
import org.georef.region.repository.StateRepository;
import org.georef.region.service.dto.StateUpdate;
import org.georef.region.service.exception.DuplicateCodeException;
import org.georef.region.service.exception.EntityNotFoundException;
import org.georef.region.service.exception.RestrictedDeletionException;

/**
 * Service for managing states and provinces.
 *
 * <p>Writes follow the same transactional outbox flow as {@link CountryService}: validate, flush
 * the state row, insert the event-log row, commit both together.
 */
@Service
public class StateService {

  private static final Logger log = LoggerFactory.getLogger(StateService.class);

  private final StateRepository stateRepository;
  private final CountryRepository countryRepository;
  private final CityRepository cityRepository;
  private final DomainValidator domainValidator;
  private final EventLogRecorder eventLogRecorder;
  private final IntegrityViolationTranslator violationTranslator;

  public StateService(
      StateRepository stateRepository,
      CountryRepository countryRepository,
      CityRepository cityRepository,
      DomainValidator domainValidator,
      EventLogRecorder eventLogRecorder,
      IntegrityViolationTranslator violationTranslator) {
    this.stateRepository = stateRepository;
    this.countryRepository = countryRepository;
    this.cityRepository = cityRepository;
    this.domainValidator = domainValidator;
    this.eventLogRecorder = eventLogRecorder;
    this.violationTranslator = violationTranslator;
  }

  /**
   * Create a new state and record a CREATE event.
   *
   * @param state The state to create (countryId, name, code)
   * @param requestInfo Request metadata for the event log
   * @return The created state with database-generated ID
   * @throws EntityNotFoundException if the parent country does not exist
   * @throws DuplicateCodeException if the code is already taken
   */
  @Transactional
  public State create(State state, RequestInfo requestInfo) {
    state.setCode(Codes.normalize(state.getCode()));
    domainValidator.validateParentExists(EntityType.COUNTRY, state.getCountryId());
    domainValidator.validateCodeUnique(EntityType.STATE, state.getCode(), null);

    State saved;
    try {
      saved = stateRepository.saveAndFlush(state);
    } catch (DataIntegrityViolationException e) {
      throw violationTranslator.translateWrite(e, EntityType.STATE, null, state.getCode());
    }

    eventLogRecorder.record(EventType.CREATE, EntityType.STATE, saved.getId(), requestInfo);

    log.info(
        "Created state id: {} code: {} country id: {}",
        saved.getId(),
        saved.getCode(),
        saved.getCountryId());
    return saved;
  }

  /**
   * Get a state by ID.
   *
   * @param id The state ID
   * @return The state
   * @throws EntityNotFoundException if the state does not exist
   */
  @Transactional(readOnly = true)
  public State getById(Long id) {
    return stateRepository
        .findById(id)
        .orElseThrow(() -> new EntityNotFoundException(EntityType.STATE.displayName(), id));
  }

  /**
   * List states in insertion order, optionally restricted to one country.
   *
   * @param countryId Country to filter by, or null for all states
   * @param skip Number of rows to skip
   * @param limit Maximum number of rows to return
   * @return States within the window
   */
  @Transactional(readOnly = true)
  public List<State> list(Long countryId, long skip, int limit) {
    var page = OffsetPageRequest.of(skip, limit);
    return countryId == null
        ? stateRepository.findAll(page).getContent()
        : stateRepository.findByCountryId(countryId, page);
  }

  /**
   * List the states of a country that must exist.
   *
   * @param countryId The country ID
   * @param skip Number of rows to skip
   * @param limit Maximum number of rows to return
   * @return States of the country within the window
   * @throws EntityNotFoundException if the country does not exist
   */
  @Transactional(readOnly = true)
  public List<State> listByCountry(Long countryId, long skip, int limit) {
    if (!countryRepository.existsById(countryId)) {
      throw new EntityNotFoundException(EntityType.COUNTRY.displayName(), countryId);
    }
    return stateRepository.findByCountryId(countryId, OffsetPageRequest.of(skip, limit));
  }

  /**
   * Partially update a state and record an UPDATE event.
   *
   * <p>Moving a state to another country checks that the new country exists; changing the code
   * checks it is not held by another state.
   *
   * @param id The state ID
   * @param update Fields to change
   * @param requestInfo Request metadata for the event log
   * @return The updated state
   * @throws EntityNotFoundException if the state or the new country does not exist
   * @throws DuplicateCodeException if the new code is held by another state
   */
  @Transactional
  public State update(Long id, StateUpdate update, RequestInfo requestInfo) {
    var state = getById(id);

    if (update.countryId() != null && !update.countryId().equals(state.getCountryId())) {
      domainValidator.validateParentExists(EntityType.COUNTRY, update.countryId());
    }

    var code = update.code() != null ? Codes.normalize(update.code()) : null;
    if (code != null && !code.equals(state.getCode())) {
      domainValidator.validateCodeUnique(EntityType.STATE, code, id);
    }

    if (update.countryId() != null) {
      state.setCountryId(update.countryId());
    }
    if (update.name() != null) {
      state.setName(update.name());
    }
    if (code != null) {
      state.setCode(code);
    }

    State saved;
    try {
      saved = stateRepository.saveAndFlush(state);
    } catch (DataIntegrityViolationException e) {
      throw violationTranslator.translateWrite(e, EntityType.STATE, id, state.getCode());
    }

    eventLogRecorder.record(EventType.UPDATE, EntityType.STATE, saved.getId(), requestInfo);

    log.info("Updated state id: {}", saved.getId());
    return saved;
  }

  /**
   * Delete a state and record a DELETE event.
   *
   * @param id The state ID
   * @param requestInfo Request metadata for the event log
   * @return The deleted state
   * @throws EntityNotFoundException if the state does not exist
   * @throws RestrictedDeletionException if cities still reference the state
   */
  @Transactional
  public State delete(Long id, RequestInfo requestInfo) {
    var state = getById(id);

    if (cityRepository.existsByStateId(id)) {
      log.debug("Refusing to delete state id: {} with existing cities", id);
      throw new RestrictedDeletionException(
          EntityType.STATE.displayName(), id, EntityType.CITY.displayName());
    }

    try {
      stateRepository.delete(state);
      stateRepository.flush();
    } catch (DataIntegrityViolationException e) {
      throw violationTranslator.translateDelete(e, EntityType.STATE, id, EntityType.CITY);
    }

    eventLogRecorder.record(EventType.DELETE, EntityType.STATE, id, requestInfo);

    log.info("Deleted state id: {} code: {}", id, state.getCode());
    return state;
  }
}
