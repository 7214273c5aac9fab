package org.georef.region.domain;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

import org.hibernate.annotations.CreationTimestamp;

/**
 * Append-only record of a single create, update or delete.
 *
 * <p>Rows are inserted in the same transaction as the mutation they describe and are never
 * updated afterwards. {@code processingStatus} and {@code processedAt} are reserved for an
 * asynchronous relay; nothing consumes them today, so every row is written as {@value
 * #PROCESSING_STATUS_COMPLETED} with no processed timestamp.
 */
@Entity
@Table(name = "event_log")
public class EventLog {

  public static final String PROCESSING_STATUS_COMPLETED = "completed";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Enumerated(EnumType.STRING)
  @Column(name = "event_type", nullable = false, length = 50, updatable = false)
  @NotNull
  private EventType eventType;

  @Convert(converter = EntityTypeConverter.class)
  @Column(name = "entity_type", nullable = false, length = 50, updatable = false)
  @NotNull
  private EntityType entityType;

  /** Id of the affected row; for deletes it is captured before the row is removed. */
  @Column(name = "entity_id", nullable = false, updatable = false)
  @NotNull
  private Long entityId;

  @Column(name = "request_method", nullable = false, length = 10, updatable = false)
  @NotNull
  private String requestMethod;

  @Column(name = "request_path", nullable = false, length = 500, updatable = false)
  @NotNull
  private String requestPath;

  @Column(name = "request_body", columnDefinition = "text", updatable = false)
  private String requestBody;

  @Column(name = "user_id", length = 100, updatable = false)
  private String userId;

  @Column(name = "ip_address", length = 45, updatable = false)
  private String ipAddress;

  @CreationTimestamp
  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "status_code", updatable = false)
  private Integer statusCode;

  @Column(name = "processing_status", nullable = false, length = 20, updatable = false)
  @NotNull
  private String processingStatus = PROCESSING_STATUS_COMPLETED;

  @Column(name = "processed_at", updatable = false)
  private Instant processedAt;

  public Long getId() {
    return id;
  }

  public EventType getEventType() {
    return eventType;
  }

  public void setEventType(EventType eventType) {
    this.eventType = eventType;
  }

  public EntityType getEntityType() {
    return entityType;
  }

  public void setEntityType(EntityType entityType) {
    this.entityType = entityType;
  }

  public Long getEntityId() {
    return entityId;
  }

  public void setEntityId(Long entityId) {
    this.entityId = entityId;
  }

  public String getRequestMethod() {
    return requestMethod;
  }

  public void setRequestMethod(String requestMethod) {
    this.requestMethod = requestMethod;
  }

  public String getRequestPath() {
    return requestPath;
  }

  public void setRequestPath(String requestPath) {
    this.requestPath = requestPath;
  }

  public String getRequestBody() {
    return requestBody;
  }

  public void setRequestBody(String requestBody) {
    this.requestBody = requestBody;
  }

  public String getUserId() {
    return userId;
  }

  public void setUserId(String userId) {
    this.userId = userId;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public void setIpAddress(String ipAddress) {
    this.ipAddress = ipAddress;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Integer getStatusCode() {
    return statusCode;
  }

  public void setStatusCode(Integer statusCode) {
    this.statusCode = statusCode;
  }

  public String getProcessingStatus() {
    return processingStatus;
  }

  public void setProcessingStatus(String processingStatus) {
    this.processingStatus = processingStatus;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }
}
