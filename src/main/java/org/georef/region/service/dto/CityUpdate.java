package org.georef.region.service.dto;

/**
 * Partial update of a city. A null field is left unchanged.
 *
 * @param name New name, or null
 * @param code New six-digit code, or null
 * @param active New activity flag, or null
 */
public record CityUpdate(String name, String code, Boolean active) {}
