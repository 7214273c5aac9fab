package org.georef.region.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "region-service")
@Validated
public class RegionServiceProperties {

  @Valid private Pagination pagination = new Pagination();

  public Pagination getPagination() {
    return pagination;
  }

  public void setPagination(Pagination pagination) {
    this.pagination = pagination;
  }

  public static class Pagination {

    /** Page size used when a list request does not specify a limit. */
    @Min(1)
    @Max(1000)
    private int defaultLimit = 100;

    /** Largest limit a list request may ask for. */
    @Min(1)
    @Max(10000)
    private int maxLimit = 1000;

    public int getDefaultLimit() {
      return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
      this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
      return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
      this.maxLimit = maxLimit;
    }
  }
}
