package org.georef.region.service.exception;

import org.georef.region.service.RegionServiceError;

/** Raised when a code is already taken within its uniqueness scope. */
public class DuplicateCodeException extends DomainException {

  private final String entityType;
  private final String code;

  public DuplicateCodeException(String entityType, String code) {
    super(
        entityType + " with code '" + code + "' already exists",
        RegionServiceError.DUPLICATE_CODE);
    this.entityType = entityType;
    this.code = code;
  }

  public String getEntityType() {
    return entityType;
  }

  public String getCode() {
    return code;
  }
}
