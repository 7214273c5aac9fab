package org.georef.region.service;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import org.georef.region.domain.EntityType;
import org.georef.region.domain.EventLog;
import org.georef.region.domain.EventType;
import org.georef.region.domain.RequestInfo;
import org.georef.region.repository.EventLogRepository;

/**
 * Writes the event-log row that accompanies every mutation.
 *
 * <p>Must be called from inside the write service's transaction: {@link Propagation#MANDATORY}
 * makes a call without one fail instead of committing the event on its own. A storage failure
 * on the insert surfaces as {@link org.georef.region.service.exception.UnexpectedStorageException}
 * and rolls back the mutation with it.
 */
@Component
public class EventLogRecorder {

  private final EventLogRepository eventLogRepository;
  private final IntegrityViolationTranslator violationTranslator;

  public EventLogRecorder(
      EventLogRepository eventLogRepository, IntegrityViolationTranslator violationTranslator) {
    this.eventLogRepository = eventLogRepository;
    this.violationTranslator = violationTranslator;
  }

  /**
   * Insert an event-log row for a mutation.
   *
   * @param eventType CREATE, UPDATE or DELETE
   * @param entityType Type of the mutated entity
   * @param entityId ID of the mutated entity (captured before removal for deletes)
   * @param requestInfo Request metadata copied verbatim into the row
   * @return The saved event-log row
   * @throws org.georef.region.service.exception.UnexpectedStorageException if storage rejects
   *     the row
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public EventLog record(
      EventType eventType, EntityType entityType, Long entityId, RequestInfo requestInfo) {
    var eventLog = new EventLog();
    eventLog.setEventType(eventType);
    eventLog.setEntityType(entityType);
    eventLog.setEntityId(entityId);
    eventLog.setRequestMethod(requestInfo.method());
    eventLog.setRequestPath(requestInfo.path());
    eventLog.setRequestBody(requestInfo.body());
    eventLog.setUserId(requestInfo.userId());
    eventLog.setIpAddress(requestInfo.ipAddress());
    eventLog.setStatusCode(requestInfo.statusCode());
    eventLog.setProcessingStatus(EventLog.PROCESSING_STATUS_COMPLETED);

    try {
      return eventLogRepository.save(eventLog);
    } catch (DataAccessException e) {
      throw violationTranslator.translateEventInsert(e, entityType, entityId);
    }
  }
}
