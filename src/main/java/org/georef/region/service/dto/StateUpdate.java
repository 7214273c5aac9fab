package org.georef.region.service.dto;

/**
 * Partial update of a state. A null field is left unchanged.
 *
 * @param countryId New parent country, or null
 * @param name New name, or null
 * @param code New ISO 3166-2 style code (any case), or null
 */
public record StateUpdate(Long countryId, String name, String code) {}
