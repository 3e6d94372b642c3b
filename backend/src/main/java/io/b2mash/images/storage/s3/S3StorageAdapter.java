package io.b2mash.images.storage.s3;

import io.b2mash.images.config.S3Config.S3Properties;
import io.b2mash.images.storage.PresignedUrl;
import io.b2mash.images.storage.StorageKeys;
import io.b2mash.images.storage.StorageService;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

/** S3 implementation of {@link StorageService}. All AWS SDK types are confined to this class. */
@Component
public class S3StorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(S3StorageAdapter.class);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final String bucketName;

  public S3StorageAdapter(S3Client s3Client, S3Presigner s3Presigner, S3Properties s3Properties) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
    this.bucketName = s3Properties.bucketName();
  }

  @Override
  public String bucketName() {
    return bucketName;
  }

  @Override
  public PresignedUrl generateUploadUrl(String key, String contentType, Duration expiry) {
    validateKey(key);
    var putRequest =
        PutObjectRequest.builder().bucket(bucketName).key(key).contentType(contentType).build();

    var presignRequest =
        PutObjectPresignRequest.builder()
            .signatureDuration(expiry)
            .putObjectRequest(putRequest)
            .build();

    var presigned = s3Presigner.presignPutObject(presignRequest);
    log.debug("Presigned upload URL issued for key={}", key);
    return new PresignedUrl(presigned.url().toExternalForm(), Instant.now().plus(expiry));
  }

  @Override
  public PresignedUrl generateDownloadUrl(String key, Duration expiry) {
    validateKey(key);
    var getRequest = GetObjectRequest.builder().bucket(bucketName).key(key).build();

    var presignRequest =
        GetObjectPresignRequest.builder()
            .signatureDuration(expiry)
            .getObjectRequest(getRequest)
            .build();

    var presigned = s3Presigner.presignGetObject(presignRequest);
    log.debug("Presigned download URL issued for key={}", key);
    return new PresignedUrl(presigned.url().toExternalForm(), Instant.now().plus(expiry));
  }

  @Override
  public Optional<Long> objectSize(String key) {
    var headRequest = HeadObjectRequest.builder().bucket(bucketName).key(key).build();
    try {
      return Optional.ofNullable(s3Client.headObject(headRequest).contentLength());
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (S3Exception e) {
      // HEAD responses carry no error body, so a missing key can surface as a bare 404
      if (e.statusCode() == 404) {
        return Optional.empty();
      }
      throw e;
    }
  }

  @Override
  public void delete(String key) {
    try {
      var deleteRequest = DeleteObjectRequest.builder().bucket(bucketName).key(key).build();
      s3Client.deleteObject(deleteRequest);
    } catch (Exception e) {
      log.warn("Best-effort S3 deletion failed for key={}: {}", key, e.getMessage());
    }
  }

  private static void validateKey(String key) {
    if (!StorageKeys.isValidImageKey(key)) {
      throw new IllegalArgumentException("Invalid storage key format");
    }
  }
}
