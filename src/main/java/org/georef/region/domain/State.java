package org.georef.region.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

/**
 * State or province entity belonging to a {@link Country}.
 *
 * <p>The parent is held as a plain foreign key column rather than a {@code @ManyToOne}
 * association: writes only ever need the id, and the {@code fk_state_country} constraint (ON
 * DELETE RESTRICT) is declared in the Flyway migration.
 */
@Entity
@Table(name = "state")
public class State {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "country_id", nullable = false)
  @NotNull
  private Long countryId;

  @Column(nullable = false, length = 100)
  @NotNull
  private String name;

  /** ISO 3166-2 style code (e.g. JP-13, US-CA), stored upper case. Unique across all states. */
  @Column(nullable = false, unique = true, length = 10)
  @NotNull
  private String code;

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getCountryId() {
    return countryId;
  }

  public void setCountryId(Long countryId) {
    this.countryId = countryId;
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
}
