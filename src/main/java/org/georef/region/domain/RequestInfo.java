package org.georef.region.domain;

/**
 * Request metadata supplied by the transport layer and copied verbatim into the event log.
 *
 * @param method HTTP method (e.g. POST)
 * @param path request path
 * @param body serialized request body, or null when the request had none
 * @param ipAddress client IP address, or null when unknown
 * @param userId acting user, or null for anonymous callers
 * @param statusCode status code the caller reports on success, or null
 */
public record RequestInfo(
    String method,
    String path,
    String body,
    String ipAddress,
    String userId,
    Integer statusCode) {}
