package org.georef.region.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import org.georef.region.domain.EntityType;
import org.georef.region.domain.EventLog;

/**
 * Repository for the append-only event log.
 *
 * <p>Only inserts are issued by the service; the finder exists for audit queries.
 */
public interface EventLogRepository extends JpaRepository<EventLog, Long> {

  /**
   * Find the history of one entity in insertion order.
   *
   * @param entityType The entity type
   * @param entityId The entity ID
   * @return Event rows for the entity, oldest first
   */
  List<EventLog> findByEntityTypeAndEntityIdOrderByIdAsc(EntityType entityType, Long entityId);
}
