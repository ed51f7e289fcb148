package com.scholary.breath.analyzer.objectstore;

import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>AWS SDK v2 talks to both real S3 and MinIO; only the endpoint and path-style flag differ. The
 * SDK retries transient failures itself; anything that reaches us is wrapped in an {@link
 * ObjectStoreException}.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    StaticCredentialsProvider credentialsProvider =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()));
    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;
    URI endpoint = URI.create(properties.endpoint());

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(endpoint)
            .forcePathStyle(properties.pathStyleAccess())
            .build();
    this.s3Presigner =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(endpoint)
            .build();
  }

  S3ObjectStoreClient(S3Client s3Client, S3Presigner s3Presigner) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
  }

  @Override
  public InputStream getObjectStream(String bucket, String key) {
    LOGGER.debug("Fetching waveform object: bucket={}, key={}", bucket, key);
    try {
      InputStream stream =
          s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Retrieved object: bucket={}, key={}", bucket, key);
      return stream;
    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);
    } catch (RuntimeException e) {
      throw failure("retrieve object", bucket, key, e);
    }
  }

  @Override
  public void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);
    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build();
      s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));
      LOGGER.info("Uploaded object: bucket={}, key={}", bucket, key);
    } catch (RuntimeException e) {
      throw failure("upload object", bucket, key, e);
    }
  }

  @Override
  public URL presignGet(String bucket, String key, Duration ttl) {
    try {
      GetObjectPresignRequest presignRequest =
          GetObjectPresignRequest.builder()
              .signatureDuration(ttl)
              .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
              .build();
      return s3Presigner.presignGetObject(presignRequest).url();
    } catch (RuntimeException e) {
      throw failure("presign object", bucket, key, e);
    }
  }

  private static ObjectStoreException failure(
      String action, String bucket, String key, RuntimeException e) {
    String message =
        e instanceof S3Exception s3
            ? String.format(
                "Failed to %s: bucket=%s, key=%s, statusCode=%s",
                action, bucket, key, s3.statusCode())
            : String.format("Unexpected error trying to %s: bucket=%s, key=%s", action, bucket, key);
    LOGGER.error(message, e);
    return new ObjectStoreException(message, e);
  }
}
