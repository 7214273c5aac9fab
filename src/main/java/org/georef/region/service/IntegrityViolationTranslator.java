package org.georef.region.service;

import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.georef.region.domain.EntityType;
import org.georef.region.service.exception.DomainException;
import org.georef.region.service.exception.DuplicateCodeException;
import org.georef.region.service.exception.RestrictedDeletionException;
import org.georef.region.service.exception.UnexpectedStorageException;

/**
 * Maps integrity violations raised by storage at flush time back onto domain errors.
 *
 * <p>Validation runs before every write, so a violation here means a concurrent writer won a race
 * or validation has a gap. The policy is the same for every entity:
 *
 * <ul>
 *   <li>unique violation (SQLSTATE 23505) becomes {@link DuplicateCodeException}
 *   <li>foreign key violation (SQLSTATE 23503) while deleting becomes {@link
 *       RestrictedDeletionException}
 *   <li>anything else becomes {@link UnexpectedStorageException}
 * </ul>
 *
 * <p>The surrounding transaction is rolled back in every case, since the returned exception is
 * unchecked and propagates out of the {@code @Transactional} service method.
 */
@Component
public class IntegrityViolationTranslator {

  private static final Logger log = LoggerFactory.getLogger(IntegrityViolationTranslator.class);

  static final String METRIC_NAME = "region.write.integrity_violations";
  static final String UNIQUE_VIOLATION = "23505";
  static final String FOREIGN_KEY_VIOLATION = "23503";

  /** Partial unique index scoping city codes to active rows. */
  static final String ACTIVE_CITY_CODE_INDEX = "ux_city_code_active";

  private final MeterRegistry meterRegistry;

  public IntegrityViolationTranslator(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /**
   * Translate a violation raised while inserting or updating a row.
   *
   * @param e The violation raised by the repository
   * @param entityType Type of the row being written
   * @param entityId ID of the row, or null for an insert
   * @param code Code the write tried to store
   * @return The exception the caller should throw
   */
  public DomainException translateWrite(
      DataIntegrityViolationException e, EntityType entityType, Long entityId, String code) {
    if (UNIQUE_VIOLATION.equals(sqlState(e))) {
      var label =
          ACTIVE_CITY_CODE_INDEX.equals(constraintName(e))
              ? DomainValidator.ACTIVE_CITY
              : entityType.displayName();
      log.warn(
          "Storage rejected duplicate {} code '{}' after validation passed (concurrent write)",
          label,
          code);
      count(entityType, "duplicate_code");
      return new DuplicateCodeException(label, code);
    }

    return unexpected(e, entityType, entityId, "write");
  }

  /**
   * Translate a violation raised while deleting a row.
   *
   * @param e The violation raised by the repository
   * @param entityType Type of the row being deleted
   * @param entityId ID of the row
   * @param childType Type of the rows that may still reference it
   * @return The exception the caller should throw
   */
  public DomainException translateDelete(
      DataIntegrityViolationException e,
      EntityType entityType,
      Long entityId,
      EntityType childType) {
    if (FOREIGN_KEY_VIOLATION.equals(sqlState(e))) {
      log.warn(
          "Storage restricted deletion of {} {}: {} rows reference it",
          entityType.displayName(),
          entityId,
          childType.displayName());
      count(entityType, "restricted_deletion");
      return new RestrictedDeletionException(
          entityType.displayName(), entityId, childType.displayName());
    }

    return unexpected(e, entityType, entityId, "delete");
  }

  /**
   * Translate a storage failure raised while inserting the event-log row of a mutation.
   *
   * <p>The event row has no unique or foreign keys, so every failure here is unexpected.
   *
   * @param e The failure raised by the event-log repository
   * @param entityType Type of the mutated entity
   * @param entityId ID of the mutated entity
   * @return The exception the caller should throw
   */
  public DomainException translateEventInsert(
      DataAccessException e, EntityType entityType, Long entityId) {
    return unexpected(e, entityType, entityId, "event-log insert");
  }

  private DomainException unexpected(
      DataAccessException e, EntityType entityType, Long entityId, String operation) {
    log.error(
        "Unexpected integrity violation on {} of {} {} (sqlState={}, constraint={})",
        operation,
        entityType.displayName(),
        entityId,
        sqlState(e),
        constraintName(e),
        e);
    count(entityType, "unexpected");
    return new UnexpectedStorageException(
        "Unexpected storage error during " + operation + " of " + entityType.displayName(), e);
  }

  private void count(EntityType entityType, String outcome) {
    Counter.builder(METRIC_NAME)
        .description("Integrity violations raised by storage after validation passed")
        .tag("entity", entityType.value())
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }

  private static String sqlState(Throwable e) {
    for (var cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLException) {
        var state = ((SQLException) cause).getSQLState();
        if (state != null) {
          return state;
        }
      }
    }
    return null;
  }

  private static String constraintName(Throwable e) {
    for (var cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof org.hibernate.exception.ConstraintViolationException) {
        return ((org.hibernate.exception.ConstraintViolationException) cause).getConstraintName();
      }
    }
    return null;
  }
}
