package org.georef.region.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link EntityType} as its lower-case value. */
@Converter
public class EntityTypeConverter implements AttributeConverter<EntityType, String> {

  @Override
  public String convertToDatabaseColumn(EntityType attribute) {
    return attribute == null ? null : attribute.value();
  }

  @Override
  public EntityType convertToEntityAttribute(String dbData) {
    return dbData == null ? null : EntityType.fromValue(dbData);
  }
}
