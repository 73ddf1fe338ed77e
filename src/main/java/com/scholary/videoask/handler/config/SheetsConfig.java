package com.scholary.videoask.handler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoask.handler.storage.GoogleSheetsValuesClient;
import com.scholary.videoask.handler.storage.ServiceAccountTokenProvider;
import com.scholary.videoask.handler.storage.SheetsProperties;
import com.scholary.videoask.handler.storage.SheetsValuesApi;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the spreadsheet result store.
 *
 * <p>This wires up the SheetsValuesApi bean using properties from application.yml. Credentials are
 * loaded lazily on the first write.
 */
@Configuration
@EnableConfigurationProperties(SheetsProperties.class)
public class SheetsConfig {

  @Bean
  public SheetsValuesApi sheetsValuesApi(SheetsProperties properties, ObjectMapper objectMapper) {
    return new GoogleSheetsValuesClient(
        properties, objectMapper, new ServiceAccountTokenProvider(properties.credentialsFile()));
  }
}
