package org.georef.region.config;

import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Region Service",
            version = "1.0",
            description =
                "Country, state/province and city reference data. Every mutation is recorded in "
                    + "the event log within the same transaction.",
            license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")),
    servers = {
      @Server(url = "http://localhost:8080/api", description = "Local environment (via gateway)"),
      @Server(
          url = "http://localhost:8085/region-service",
          description = "Local environment (direct)")
    })
public class OpenApiConfig {}
