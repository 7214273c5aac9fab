package org.georef.region.domain;

/** Kind of mutation recorded by an {@link EventLog} row. */
public enum EventType {
  CREATE,
  UPDATE,
  DELETE
}
