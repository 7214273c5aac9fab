package org.georef.region.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the Region Service.
 *
 * <p>Note: the DataSource, EntityManagerFactory and transaction manager are auto-configured by
 * Spring Boot from spring.datasource.* and spring.jpa.* properties in application.yml. They are
 * created once at startup and closed on context shutdown.
 */
@Configuration
@EnableConfigurationProperties(RegionServiceProperties.class)
public class RegionServiceConfig {}
