package org.georef.region.service.exception;

import org.georef.region.service.RegionServiceError;

/**
 * Base class for errors raised by the region services.
 *
 * <p>Each subclass is tagged with a {@link RegionServiceError} kind so the transport layer can
 * select a response by switching on {@link #getError()} rather than on the exception class.
 */
public abstract class DomainException extends RuntimeException {

  private final RegionServiceError error;

  protected DomainException(String message, RegionServiceError error) {
    super(message);
    this.error = error;
  }

  protected DomainException(String message, RegionServiceError error, Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  public RegionServiceError getError() {
    return error;
  }
}
