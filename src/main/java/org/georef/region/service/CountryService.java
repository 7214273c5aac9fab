package org.georef.region.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.georef.region.domain.Country;
import org.georef.region.domain.EntityType;
import org.georef.region.domain.EventType;
import org.georef.region.domain.RequestInfo;
import org.georef.region.repository.CountryRepository;
import org.georef.region.repository.OffsetPageRequest;
import org.georef.region.repository.StateRepository;
import org.georef.region.service.dto.CountryUpdate;
import org.georef.region.service.exception.DuplicateCodeException;
import org.georef.region.service.exception.EntityNotFoundException;
import org.georef.region.service.exception.RestrictedDeletionException;
import org.georef.region.service.exception.UnexpectedStorageException;

/**
 * Service for managing countries.
 *
 * <p>Every mutation writes its {@link org.georef.region.domain.EventLog} row in the same database
 * transaction as the country row (transactional outbox used as an audit log). If either write
 * fails, both are rolled back.
 *
 * <p><b>Write flow:</b>
 *
 * <ol>
 *   <li>Domain validation against committed state ({@link DomainValidator})
 *   <li>Country row inserted/updated/deleted and flushed, so constraint violations surface here
 *   <li>Event-log row inserted with the country id
 *   <li>Transaction commits both rows
 * </ol>
 *
 * <p>Read operations never validate and never write to the event log.
 */
@Service
public class CountryService {

  private static final Logger log = LoggerFactory.getLogger(CountryService.class);

  private final CountryRepository countryRepository;
  private final StateRepository stateRepository;
  private final DomainValidator domainValidator;
  private final EventLogRecorder eventLogRecorder;
  private final IntegrityViolationTranslator violationTranslator;

  /**
   * Constructor for CountryService.
   *
   * @param countryRepository The country repository
   * @param stateRepository The state repository, used for the delete restriction check
   * @param domainValidator Pre-write domain checks
   * @param eventLogRecorder Writes the event-log row for each mutation
   * @param violationTranslator Maps flush-time integrity violations onto domain errors
   */
  public CountryService(
      CountryRepository countryRepository,
      StateRepository stateRepository,
      DomainValidator domainValidator,
      EventLogRecorder eventLogRecorder,
      IntegrityViolationTranslator violationTranslator) {
    this.countryRepository = countryRepository;
    this.stateRepository = stateRepository;
    this.domainValidator = domainValidator;
    this.eventLogRecorder = eventLogRecorder;
    this.violationTranslator = violationTranslator;
  }

  /**
   * Create a new country and record a CREATE event.
   *
   * <p>The code is normalised to upper case before the uniqueness check, so "jp" collides with an
   * existing "JP".
   *
   * @param country The country to create (name and code)
   * @param requestInfo Request metadata for the event log
   * @return The created country with database-generated ID
   * @throws DuplicateCodeException if the code is already taken
   * @throws UnexpectedStorageException if storage rejects the write for another reason
   */
  @Transactional
  public Country create(Country country, RequestInfo requestInfo) {
    country.setCode(Codes.normalize(country.getCode()));
    domainValidator.validateCodeUnique(EntityType.COUNTRY, country.getCode(), null);

    Country saved;
    try {
      saved = countryRepository.saveAndFlush(country);
    } catch (DataIntegrityViolationException e) {
      throw violationTranslator.translateWrite(e, EntityType.COUNTRY, null, country.getCode());
    }

    eventLogRecorder.record(EventType.CREATE, EntityType.COUNTRY, saved.getId(), requestInfo);

    log.info("Created country id: {} code: {}", saved.getId(), saved.getCode());
    return saved;
  }

  /**
   * Get a country by ID.
   *
   * @param id The country ID
   * @return The country
   * @throws EntityNotFoundException if the country does not exist
   */
  @Transactional(readOnly = true)
  public Country getById(Long id) {
    return countryRepository
        .findById(id)
        .orElseThrow(() -> new EntityNotFoundException(EntityType.COUNTRY.displayName(), id));
  }

  /**
   * List countries in insertion order.
   *
   * @param skip Number of rows to skip
   * @param limit Maximum number of rows to return
   * @return Countries within the window
   */
  @Transactional(readOnly = true)
  public List<Country> list(long skip, int limit) {
    return countryRepository.findAll(OffsetPageRequest.of(skip, limit)).getContent();
  }

  /**
   * Partially update a country and record an UPDATE event.
   *
   * <p>Only non-null fields of {@code update} are applied.
   *
   * @param id The country ID
   * @param update Fields to change
   * @param requestInfo Request metadata for the event log
   * @return The updated country
   * @throws EntityNotFoundException if the country does not exist
   * @throws DuplicateCodeException if the new code is held by another country
   */
  @Transactional
  public Country update(Long id, CountryUpdate update, RequestInfo requestInfo) {
    var country = getById(id);

    var code = update.code() != null ? Codes.normalize(update.code()) : null;
    if (code != null && !code.equals(country.getCode())) {
      domainValidator.validateCodeUnique(EntityType.COUNTRY, code, id);
    }

    if (update.name() != null) {
      country.setName(update.name());
    }
    if (code != null) {
      country.setCode(code);
    }

    Country saved;
    try {
      saved = countryRepository.saveAndFlush(country);
    } catch (DataIntegrityViolationException e) {
      throw violationTranslator.translateWrite(e, EntityType.COUNTRY, id, country.getCode());
    }

    eventLogRecorder.record(EventType.UPDATE, EntityType.COUNTRY, saved.getId(), requestInfo);

    log.info("Updated country id: {}", saved.getId());
    return saved;
  }

  /**
   * Delete a country and record a DELETE event.
   *
   * <p>Deletion is refused while any state belongs to the country. The refusal happens before
   * anything is written, so no DELETE event exists for a country that was not deleted.
   *
   * @param id The country ID
   * @param requestInfo Request metadata for the event log
   * @return The deleted country
   * @throws EntityNotFoundException if the country does not exist
   * @throws RestrictedDeletionException if states still reference the country
   */
  @Transactional
  public Country delete(Long id, RequestInfo requestInfo) {
    var country = getById(id);

    if (stateRepository.existsByCountryId(id)) {
      log.debug("Refusing to delete country id: {} with existing states", id);
      throw new RestrictedDeletionException(
          EntityType.COUNTRY.displayName(), id, EntityType.STATE.displayName());
    }

    try {
      countryRepository.delete(country);
      countryRepository.flush();
    } catch (DataIntegrityViolationException e) {
      throw violationTranslator.translateDelete(e, EntityType.COUNTRY, id, EntityType.STATE);
    }

    eventLogRecorder.record(EventType.DELETE, EntityType.COUNTRY, id, requestInfo);

    log.info("Deleted country id: {} code: {}", id, country.getCode());
    return country;
  }
}
