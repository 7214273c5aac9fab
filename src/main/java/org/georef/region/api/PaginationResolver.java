package org.georef.region.api;

import org.springframework.stereotype.Component;

import org.georef.region.config.RegionServiceProperties;

/** Applies the configured default and maximum page sizes to list request parameters. */
@Component
public class PaginationResolver {

  private final RegionServiceProperties properties;

  public PaginationResolver(RegionServiceProperties properties) {
    this.properties = properties;
  }

  /**
   * Resolve the page window of a list request.
   *
   * @param skip Requested number of rows to skip, or null for 0
   * @param limit Requested page size, or null for the configured default
   * @return The validated window
   * @throws IllegalArgumentException if skip is outside 0..{@link Integer#MAX_VALUE} or limit is
   *     outside 1..max-limit
   */
  public PageWindow resolve(Long skip, Integer limit) {
    var pagination = properties.getPagination();
    long resolvedSkip = skip != null ? skip : 0L;
    int resolvedLimit = limit != null ? limit : pagination.getDefaultLimit();

    if (resolvedSkip < 0) {
      throw new IllegalArgumentException("skip must be greater than or equal to 0");
    }
    // JPA query offsets are int
    if (resolvedSkip > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("skip must not exceed " + Integer.MAX_VALUE);
    }
    if (resolvedLimit < 1 || resolvedLimit > pagination.getMaxLimit()) {
      throw new IllegalArgumentException(
          "limit must be between 1 and " + pagination.getMaxLimit());
    }

    return new PageWindow(resolvedSkip, resolvedLimit);
  }
}
