package org.georef.region.api;

/**
 * Validated offset/limit window of a list request.
 *
 * @param skip Number of rows to skip
 * @param limit Maximum number of rows to return
 */
public record PageWindow(long skip, int limit) {}
