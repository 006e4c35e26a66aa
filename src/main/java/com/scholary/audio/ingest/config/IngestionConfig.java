package com.scholary.audio.ingest.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the ingestion pipeline.
 *
 * <p>Enables the IngestionProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class IngestionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
