package io.b2mash.images.image;

import io.b2mash.images.exception.ForbiddenException;
import io.b2mash.images.exception.InvalidStateException;
import io.b2mash.images.exception.ResourceConflictException;
import io.b2mash.images.exception.ResourceGoneException;
import io.b2mash.images.exception.ResourceNotFoundException;
import io.b2mash.images.exception.ValidationFailedException;
import io.b2mash.images.storage.StorageKeys;
import io.b2mash.images.storage.StorageService;
import io.b2mash.images.validation.ImageValidator;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;

@Service
public class ImageService {

  private static final Logger log = LoggerFactory.getLogger(ImageService.class);

  private final ImageMetadataRepository imageRepository;
  private final StorageService storageService;
  private final ImageValidator validator;
  private final PageTokenCodec pageTokenCodec;

  public ImageService(
      ImageMetadataRepository imageRepository,
      StorageService storageService,
      ImageValidator validator,
      PageTokenCodec pageTokenCodec) {
    this.imageRepository = imageRepository;
    this.storageService = storageService;
    this.validator = validator;
    this.pageTokenCodec = pageTokenCodec;
  }

  /**
   * Reserves a record in {@link ImageStatus#PROCESSING} and issues a presigned PUT URL for the
   * object. The client uploads directly to storage and then activates the record.
   */
  public UploadInitResult initiateUpload(
      String userId,
      String filename,
      String contentType,
      List<String> tags,
      String description,
      Integer expirySeconds) {
    validator.requireUserId(userId);
    String normalizedType = validator.requireContentType(contentType);
    List<String> validTags = validator.requireTags(tags);
    validator.requireDescription(description);
    Duration expiry = validator.resolveExpiry(expirySeconds);
    String safeName = ImageValidator.sanitizeFilename(filename);

    String s3Key = StorageKeys.buildImageKey(userId, safeName, LocalDate.now(ZoneOffset.UTC));
    var presigned = storageService.generateUploadUrl(s3Key, normalizedType, expiry);

    var image =
        ImageMetadata.newUpload(
            userId,
            safeName,
            normalizedType,
            storageService.bucketName(),
            s3Key,
            validTags,
            description);
    imageRepository.save(image);

    log.info(
        "Upload initiated: imageId={}, userId={}, key={}", image.getImageId(), userId, s3Key);
    return new UploadInitResult(
        image,
        presigned.url(),
        expiry.toSeconds(),
        presigned.expiresAt(),
        Map.of("Content-Type", normalizedType));
  }

  public ImageMetadata getImage(String imageId, String userId) {
    return loadOwned(imageId, userId);
  }

  /**
   * Lists the caller's images newest first. A {@code user_id} filter naming someone else is
   * rejected.
   */
  public ListResult listImages(String callerUserId, ListCriteria criteria) {
    validator.requireUserId(callerUserId);
    String userId = criteria.userId() != null ? criteria.userId() : callerUserId;
    if (!callerUserId.equals(userId)) {
      throw new ForbiddenException("Access denied", "Images of another user cannot be listed");
    }

    ImageStatus status =
        criteria.status() != null ? validator.parseStatus(criteria.status()) : null;
    String contentType =
        criteria.contentType() != null
            ? validator.requireContentType(criteria.contentType())
            : null;
    requireSizeRange(criteria.minSize(), criteria.maxSize());

    var query =
        new ImageQuery(
            userId,
            validator.parseTagFilter(criteria.tags()),
            contentType,
            status,
            criteria.minSize(),
            criteria.maxSize(),
            validator.resolvePageSize(criteria.limit()),
            pageTokenCodec.decode(criteria.nextToken(), userId));

    var page = imageRepository.findByUser(query);
    log.debug("Listed {} images for userId={}", page.items().size(), userId);
    return new ListResult(page.items(), pageTokenCodec.encode(page.lastKey()), page.hasMore());
  }

  /**
   * Moves an image to a new status. Activation requires the object to be present in storage; the
   * stored length is used as the size when the caller does not send one.
   */
  public ImageMetadata updateStatus(
      String imageId, String userId, String status, Long size, Integer width, Integer height) {
    ImageStatus target = validator.parseStatus(status);
    if (!target.isUpdatable()) {
      throw new ValidationFailedException(
          "status", "Status must be one of: processing, active, error");
    }
    if (size != null) {
      validator.requireFileSize(size);
    }
    validator.requirePositive("width", width);
    validator.requirePositive("height", height);

    var image = loadOwned(imageId, userId);
    if (image.isDeleted()) {
      throw new ResourceConflictException(
          "Image deleted", "Cannot update status of deleted image " + image.getImageId());
    }
    if (!image.getStatus().canTransitionTo(target)) {
      log.warn(
          "Rejected status transition: imageId={}, from={}, to={}",
          image.getImageId(),
          image.getStatus().value(),
          target.value());
      throw new ResourceConflictException(
          "Invalid status transition",
          "Cannot change status from " + image.getStatus().value() + " to " + target.value());
    }

    Long effectiveSize = size;
    if (target == ImageStatus.ACTIVE) {
      Long storedSize = probeObject(image);
      if (effectiveSize == null) {
        effectiveSize = storedSize;
      }
    }

    ImageStatus previous = image.getStatus();
    image.applyStatus(target, effectiveSize, width, height, Instant.now());
    imageRepository.save(image);

    log.info(
        "Image status changed: imageId={}, from={}, to={}",
        image.getImageId(),
        previous.value(),
        target.value());
    return image;
  }

  /**
   * Soft delete marks the record deleted and keeps the object. Hard delete removes the object on a
   * best-effort basis and then the record.
   */
  public DeleteResult deleteImage(String imageId, String userId, boolean hardDelete) {
    var image = loadOwned(imageId, userId);

    if (hardDelete) {
      storageService.delete(image.getS3Key());
      imageRepository.deleteById(image.getImageId());
      log.info("Image hard-deleted: imageId={}, key={}", image.getImageId(), image.getS3Key());
      return new DeleteResult(image.getImageId(), DeleteType.HARD);
    }

    if (!image.isDeleted()) {
      image.markDeleted();
      imageRepository.save(image);
      log.info("Image soft-deleted: imageId={}", image.getImageId());
    }
    return new DeleteResult(image.getImageId(), DeleteType.SOFT);
  }

  public PresignDownloadResult getDownloadUrl(
      String imageId, String userId, Integer expirySeconds) {
    Duration expiry = validator.resolveExpiry(expirySeconds);
    var image = loadOwned(imageId, userId);
    if (image.isDeleted()) {
      throw new ResourceGoneException(
          "Image deleted", "Image " + image.getImageId() + " has been deleted");
    }
    var presigned = storageService.generateDownloadUrl(image.getS3Key(), expiry);
    return new PresignDownloadResult(
        image.getImageId(), presigned.url(), expiry.toSeconds(), presigned.expiresAt());
  }

  private ImageMetadata loadOwned(String imageId, String userId) {
    validator.requireUserId(userId);
    String id = validator.requireImageId(imageId);
    var image =
        imageRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Image", id));
    if (!image.isOwnedBy(userId)) {
      throw new ForbiddenException(
          "Access denied", "Image " + id + " does not belong to the requesting user");
    }
    return image;
  }

  /**
   * Returns the stored object size, or null when the probe itself failed and the update proceeds
   * without it. A missing object rejects the activation.
   */
  private Long probeObject(ImageMetadata image) {
    Optional<Long> storedSize;
    try {
      storedSize = storageService.objectSize(image.getS3Key());
    } catch (SdkException e) {
      log.warn(
          "Could not verify object for imageId={}, key={}: {}",
          image.getImageId(),
          image.getS3Key(),
          e.getMessage());
      return null;
    }
    if (storedSize.isEmpty()) {
      throw new InvalidStateException(
          "Object not uploaded",
          "Image file not found in storage. Upload the file before activating the image.");
    }
    return storedSize.get();
  }

  private static void requireSizeRange(Long minSize, Long maxSize) {
    if (minSize != null && minSize < 0) {
      throw new ValidationFailedException("min_size", "min_size cannot be negative");
    }
    if (maxSize != null && maxSize < 0) {
      throw new ValidationFailedException("max_size", "max_size cannot be negative");
    }
    if (minSize != null && maxSize != null && minSize > maxSize) {
      throw new ValidationFailedException("min_size", "min_size cannot exceed max_size");
    }
  }

  public enum DeleteType {
    SOFT("soft"),
    HARD("hard");

    private final String value;

    DeleteType(String value) {
      this.value = value;
    }

    public String value() {
      return value;
    }
  }

  /** Raw list parameters as received; validated and normalized by {@link #listImages}. */
  public record ListCriteria(
      String userId,
      String tags,
      String contentType,
      String status,
      Long minSize,
      Long maxSize,
      Integer limit,
      String nextToken) {}

  public record UploadInitResult(
      ImageMetadata image,
      String uploadUrl,
      long expiresInSeconds,
      Instant expiresAt,
      Map<String, String> headers) {}

  public record ListResult(List<ImageMetadata> items, String nextToken, boolean hasMore) {}

  public record DeleteResult(String imageId, DeleteType deleteType) {}

  public record PresignDownloadResult(
      String imageId, String url, long expiresInSeconds, Instant expiresAt) {}
}
