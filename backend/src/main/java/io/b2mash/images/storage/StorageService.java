package io.b2mash.images.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * Abstraction for object storage operations. Domain services inject this interface instead of
 * vendor-specific clients (e.g., S3Client). Image bytes never pass through the service: clients
 * transfer them with presigned URLs.
 */
public interface StorageService {

  /** Name of the bucket all image objects live in. */
  String bucketName();

  /** Generate a presigned upload URL (time-limited) bound to the given content type. */
  PresignedUrl generateUploadUrl(String key, String contentType, Duration expiry);

  /** Generate a presigned download URL (time-limited). */
  PresignedUrl generateDownloadUrl(String key, Duration expiry);

  /** Size in bytes of the stored object, or empty when no object exists under the key. */
  Optional<Long> objectSize(String key);

  /** Delete an object. Best-effort -- logs warning on failure. */
  void delete(String key);
}
