package org.georef.region.service;

/** Error kinds raised by the region write and read services. */
public enum RegionServiceError {
  /** The addressed entity, or a referenced parent, does not exist. */
  ENTITY_NOT_FOUND,

  /** Another row already holds the code within its uniqueness scope. */
  DUPLICATE_CODE,

  /** The entity cannot be deleted while child rows still reference it. */
  RESTRICTED_DELETION,

  /** Storage rejected a write that validation should have caught. */
  UNEXPECTED_STORAGE_ERROR,
}
