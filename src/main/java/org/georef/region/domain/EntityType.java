package org.georef.region.domain;

/** Entity kinds managed by the service, as recorded in the event log and in error messages. */
public enum EntityType {
  COUNTRY("country", "Country"),
  STATE("state", "State"),
  CITY("city", "City");

  private final String value;
  private final String displayName;

  EntityType(String value, String displayName) {
    this.value = value;
    this.displayName = displayName;
  }

  /** Lower-case name stored in {@code event_log.entity_type}. */
  public String value() {
    return value;
  }

  public String displayName() {
    return displayName;
  }

  public static EntityType fromValue(String value) {
    for (var type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown entity type: " + value);
  }
}
