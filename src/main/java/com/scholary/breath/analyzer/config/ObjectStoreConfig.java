package com.scholary.breath.analyzer.config;

import com.scholary.breath.analyzer.objectstore.ObjectStoreClient;
import com.scholary.breath.analyzer.objectstore.ObjectStoreProperties;
import com.scholary.breath.analyzer.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires up the ObjectStoreClient bean from the "objectstore.*" properties.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
