package org.georef.region.service.exception;

import org.georef.region.service.RegionServiceError;

/** Raised when an entity, or a parent referenced by a write, does not exist. */
public class EntityNotFoundException extends DomainException {

  private final String entityType;
  private final Long entityId;

  public EntityNotFoundException(String entityType, Long entityId) {
    super(entityType + " with id " + entityId + " not found", RegionServiceError.ENTITY_NOT_FOUND);
    this.entityType = entityType;
    this.entityId = entityId;
  }

  public String getEntityType() {
    return entityType;
  }

  public Long getEntityId() {
    return entityId;
  }
}
