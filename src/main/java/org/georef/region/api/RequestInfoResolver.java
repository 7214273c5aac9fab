package org.georef.region.api;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.georef.region.domain.RequestInfo;

/**
 * Builds the {@link RequestInfo} stored with each event-log row from the current HTTP request.
 *
 * <p>The body is the validated request DTO serialised with the application's {@link
 * ObjectMapper}, not the raw payload. Update DTOs omit null fields, so the stored body shows only
 * what the caller changed.
 *
 * <p>Header-supplied values are rejected when they exceed the event-log column sizes, before any
 * write happens.
 */
@Component
public class RequestInfoResolver {

  static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
  static final String USER_ID_HEADER = "X-User-Id";

  static final int MAX_PATH_LENGTH = 500;
  static final int MAX_USER_ID_LENGTH = 100;
  static final int MAX_IP_ADDRESS_LENGTH = 45;

  private final ObjectMapper objectMapper;

  public RequestInfoResolver(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Resolve request metadata.
   *
   * @param request The current servlet request
   * @param body The validated request DTO, or null when the request has no body
   * @param status The status the endpoint answers with on success
   * @return Request metadata for the event log
   * @throws IllegalArgumentException if the path, client address or user id is too long to store
   */
  public RequestInfo resolve(HttpServletRequest request, Object body, HttpStatus status) {
    return new RequestInfo(
        request.getMethod(),
        bounded("request path", request.getRequestURI(), MAX_PATH_LENGTH),
        serialize(body),
        bounded(FORWARDED_FOR_HEADER + " client address", clientIp(request), MAX_IP_ADDRESS_LENGTH),
        bounded(USER_ID_HEADER + " header", userId(request), MAX_USER_ID_LENGTH),
        status.value());
  }

  private String serialize(Object body) {
    if (body == null) {
      return null;
    }

    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to serialize request body of type " + body.getClass().getSimpleName(), e);
    }
  }

  private static String clientIp(HttpServletRequest request) {
    var forwarded = request.getHeader(FORWARDED_FOR_HEADER);
    if (StringUtils.hasText(forwarded)) {
      return forwarded.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }

  private static String userId(HttpServletRequest request) {
    var userId = request.getHeader(USER_ID_HEADER);
    return StringUtils.hasText(userId) ? userId : null;
  }

  private static String bounded(String what, String value, int maxLength) {
    if (value != null && value.length() > maxLength) {
      throw new IllegalArgumentException(what + " must not exceed " + maxLength + " characters");
    }
    return value;
  }
}
