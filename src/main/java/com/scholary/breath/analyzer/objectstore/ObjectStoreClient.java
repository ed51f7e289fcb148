package com.scholary.breath.analyzer.objectstore;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Abstraction for the object storage holding waveform files and result tables.
 *
 * <p>Keeps the analysis service independent of S3/MinIO and easy to mock.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller closes it.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Generate a presigned URL for temporary read access.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);

  /** Store an in-memory object. */
  default void putBytes(String bucket, String key, byte[] data, String contentType) {
    putObject(bucket, key, new ByteArrayInputStream(data), data.length, contentType);
  }
}
