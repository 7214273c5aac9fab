package org.georef.region.fixture;

import org.georef.region.domain.Country;

/**
 * Fluent builder for {@link Country} test data.
 *
 * <p>Defaults to Japan (JP) with no ID.
 */
public class CountryTestBuilder {

  private Long id;
  private String name = TestConstants.COUNTRY_JAPAN_NAME;
  private String code = TestConstants.COUNTRY_JAPAN_CODE;

  public static CountryTestBuilder defaultJapan() {
    return new CountryTestBuilder();
  }

  public static CountryTestBuilder defaultUnitedStates() {
    return new CountryTestBuilder()
        .withName(TestConstants.COUNTRY_US_NAME)
        .withCode(TestConstants.COUNTRY_US_CODE);
  }

  public CountryTestBuilder withId(Long id) {
    this.id = id;
    return this;
  }

  public CountryTestBuilder withName(String name) {
    this.name = name;
    return this;
  }

  public CountryTestBuilder withCode(String code) {
    this.code = code;
    return this;
  }

  public Country build() {
    var country = new Country();
    country.setId(id);
    country.setName(name);
    country.setCode(code);
    return country;
  }
}
