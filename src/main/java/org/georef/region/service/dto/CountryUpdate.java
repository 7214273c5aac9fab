package org.georef.region.service.dto;

/**
 * Partial update of a country. A null field is left unchanged.
 *
 * @param name New name, or null
 * @param code New ISO 3166-1 alpha-2 code (any case), or null
 */
public record CountryUpdate(String name, String code) {}
