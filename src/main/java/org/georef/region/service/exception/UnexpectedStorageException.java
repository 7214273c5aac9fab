package org.georef.region.service.exception;

import org.georef.region.service.RegionServiceError;

/**
 * Raised when storage rejects a write for a reason validation does not cover.
 *
 * <p>The message and cause are meant for server-side logs only; callers receive a generic
 * failure.
 */
public class UnexpectedStorageException extends DomainException {

  public UnexpectedStorageException(String message, Throwable cause) {
    super(message, RegionServiceError.UNEXPECTED_STORAGE_ERROR, cause);
  }
}
