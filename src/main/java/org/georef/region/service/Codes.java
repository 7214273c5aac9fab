package org.georef.region.service;

import java.util.Locale;

/** Normalisation shared by country and state codes. */
final class Codes {

  private Codes() {}

  /** Upper-cases a code; null stays null. */
  static String normalize(String code) {
    return code == null ? null : code.toUpperCase(Locale.ROOT);
  }
}
