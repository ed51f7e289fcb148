package com.scholary.breath.analyzer.objectstore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    @Positive long presignTtlMinutes) {

  public ObjectStoreProperties {
    if (endpoint == null || endpoint.isBlank()) {
      throw new IllegalArgumentException("objectstore.endpoint is required");
    }
  }
}
