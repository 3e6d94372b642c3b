package io.b2mash.images.image;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

/**
 * Metadata record of one uploaded image, stored as a single item in the images table. The object
 * bytes live in the object store under {@link #getS3Key()}.
 */
@DynamoDbBean
public class ImageMetadata {

  public static final String USER_INDEX = "UserIndex";
  public static final String STATUS_INDEX = "StatusIndex";

  public static final String PRESIGNED_UPLOAD = "presigned_upload";
  public static final String STATUS_UPDATED_AT = "status_updated_at";

  private String imageId;
  private String userId;
  private String filename;
  private String contentType;
  private long size;
  private String s3Bucket;
  private String s3Key;
  private Instant uploadTimestamp;
  private List<String> tags = new ArrayList<>();
  private String description;
  private Integer width;
  private Integer height;
  private ImageStatus status;
  private Map<String, String> metadata = new HashMap<>();

  /** Required by the DynamoDB bean mapper. */
  public ImageMetadata() {}

  /** A freshly reserved record for an upload that has not reached the object store yet. */
  public static ImageMetadata newUpload(
      String userId,
      String filename,
      String contentType,
      String s3Bucket,
      String s3Key,
      List<String> tags,
      String description) {
    var image = new ImageMetadata();
    image.imageId = UUID.randomUUID().toString();
    image.userId = userId;
    image.filename = filename;
    image.contentType = contentType;
    image.size = 0;
    image.s3Bucket = s3Bucket;
    image.s3Key = s3Key;
    image.uploadTimestamp = Instant.now().truncatedTo(ChronoUnit.MICROS);
    image.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    image.description = description;
    image.status = ImageStatus.PROCESSING;
    image.metadata = new HashMap<>(Map.of(PRESIGNED_UPLOAD, "true"));
    return image;
  }

  public boolean isOwnedBy(String candidateUserId) {
    return userId != null && userId.equals(candidateUserId);
  }

  public boolean isDeleted() {
    return status == ImageStatus.DELETED;
  }

  public void markDeleted() {
    this.status = ImageStatus.DELETED;
  }

  /**
   * Moves the record to {@code newStatus}. The size is only recorded for active images; null
   * arguments leave the current value untouched.
   */
  public void applyStatus(
      ImageStatus newStatus, Long newSize, Integer newWidth, Integer newHeight, Instant at) {
    this.status = newStatus;
    if (newSize != null && newStatus == ImageStatus.ACTIVE) {
      this.size = newSize;
    }
    if (newWidth != null) {
      this.width = newWidth;
    }
    if (newHeight != null) {
      this.height = newHeight;
    }
    if (metadata == null) {
      metadata = new HashMap<>();
    }
    metadata.put(STATUS_UPDATED_AT, at.toString());
  }

  @DynamoDbPartitionKey
  @DynamoDbAttribute("image_id")
  public String getImageId() {
    return imageId;
  }

  public void setImageId(String imageId) {
    this.imageId = imageId;
  }

  @DynamoDbSecondaryPartitionKey(indexNames = USER_INDEX)
  @DynamoDbAttribute("user_id")
  public String getUserId() {
    return userId;
  }

  public void setUserId(String userId) {
    this.userId = userId;
  }

  @DynamoDbAttribute("filename")
  public String getFilename() {
    return filename;
  }

  public void setFilename(String filename) {
    this.filename = filename;
  }

  @DynamoDbAttribute("content_type")
  public String getContentType() {
    return contentType;
  }

  public void setContentType(String contentType) {
    this.contentType = contentType;
  }

  @DynamoDbAttribute("size")
  public long getSize() {
    return size;
  }

  public void setSize(long size) {
    this.size = size;
  }

  @DynamoDbAttribute("s3_bucket")
  public String getS3Bucket() {
    return s3Bucket;
  }

  public void setS3Bucket(String s3Bucket) {
    this.s3Bucket = s3Bucket;
  }

  @DynamoDbAttribute("s3_key")
  public String getS3Key() {
    return s3Key;
  }

  public void setS3Key(String s3Key) {
    this.s3Key = s3Key;
  }

  @DynamoDbSecondarySortKey(indexNames = {USER_INDEX, STATUS_INDEX})
  @DynamoDbConvertedBy(TimestampAttributeConverter.class)
  @DynamoDbAttribute("upload_timestamp")
  public Instant getUploadTimestamp() {
    return uploadTimestamp;
  }

  public void setUploadTimestamp(Instant uploadTimestamp) {
    this.uploadTimestamp = uploadTimestamp;
  }

  @DynamoDbAttribute("tags")
  public List<String> getTags() {
    return tags;
  }

  public void setTags(List<String> tags) {
    this.tags = tags;
  }

  @DynamoDbAttribute("description")
  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  @DynamoDbAttribute("width")
  public Integer getWidth() {
    return width;
  }

  public void setWidth(Integer width) {
    this.width = width;
  }

  @DynamoDbAttribute("height")
  public Integer getHeight() {
    return height;
  }

  public void setHeight(Integer height) {
    this.height = height;
  }

  @DynamoDbSecondaryPartitionKey(indexNames = STATUS_INDEX)
  @DynamoDbConvertedBy(ImageStatusAttributeConverter.class)
  @DynamoDbAttribute("status")
  public ImageStatus getStatus() {
    return status;
  }

  public void setStatus(ImageStatus status) {
    this.status = status;
  }

  @DynamoDbAttribute("metadata")
  public Map<String, String> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, String> metadata) {
    this.metadata = metadata;
  }
}
