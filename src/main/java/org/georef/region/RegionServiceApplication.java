package org.georef.region;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegionServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(RegionServiceApplication.class, args);
  }
}
