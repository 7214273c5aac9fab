package org.georef.region.service.exception;

import org.georef.region.service.RegionServiceError;

/** Raised when deleting a parent that child rows still reference. */
public class RestrictedDeletionException extends DomainException {

  private final String entityType;
  private final Long entityId;
  private final String blockingChildType;

  public RestrictedDeletionException(String entityType, Long entityId, String blockingChildType) {
    super(
        "Cannot delete "
            + entityType
            + " with id "
            + entityId
            + ": "
            + blockingChildType
            + " records still reference it",
        RegionServiceError.RESTRICTED_DELETION);
    this.entityType = entityType;
    this.entityId = entityId;
    this.blockingChildType = blockingChildType;
  }

  public String getEntityType() {
    return entityType;
  }

  public Long getEntityId() {
    return entityId;
  }

  public String getBlockingChildType() {
    return blockingChildType;
  }
}
