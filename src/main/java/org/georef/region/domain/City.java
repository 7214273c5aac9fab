package org.georef.region.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

/**
 * City (municipality) entity belonging to a {@link State}.
 *
 * <p>Existence and activity are independent: an inactive city still exists and can be read with
 * {@code includeInactive}, while deleting a city removes the row.
 *
 * <p>The code is unique only among active cities. The partial unique index {@code
 * ux_city_code_active} (WHERE is_active) enforces this in storage, so a code freed by a
 * deactivated city can be reused.
 */
@Entity
@Table(name = "city")
public class City {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "state_id", nullable = false)
  @NotNull
  private Long stateId;

  @Column(nullable = false, length = 100)
  @NotNull
  private String name;

  /** Six-digit local government code. */
  @Column(nullable = false, length = 20)
  @NotNull
  private String code;

  @Column(name = "is_active", nullable = false)
  private boolean active = true;

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getStateId() {
    return stateId;
  }

  public void setStateId(Long stateId) {
    this.stateId = stateId;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }
}
