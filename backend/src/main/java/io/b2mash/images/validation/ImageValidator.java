package io.b2mash.images.validation;

import io.b2mash.images.config.ImageConfig.ImageProperties;
import io.b2mash.images.exception.ValidationFailedException;
import io.b2mash.images.image.ImageStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Field validation for image requests. Each {@code require*} method returns the normalized value
 * or throws {@link ValidationFailedException} naming the offending field.
 */
@Component
public class ImageValidator {

  static final int MAX_TAGS = 10;
  static final int MAX_TAG_LENGTH = 50;
  static final int MAX_DESCRIPTION_LENGTH = 500;
  static final int MAX_FILENAME_LENGTH = 255;

  private static final Pattern USER_ID = Pattern.compile("^[A-Za-z0-9_-]{3,128}$");
  private static final Pattern UUID =
      Pattern.compile(
          "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern TAG = Pattern.compile("^[A-Za-z0-9 _-]+$");
  private static final Pattern UNSAFE_FILENAME_CHARS =
      Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1f]");

  private final ImageProperties properties;

  public ImageValidator(ImageProperties properties) {
    this.properties = properties;
  }

  public String requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationFailedException("user_id", "User ID is required");
    }
    if (!USER_ID.matcher(userId).matches()) {
      throw new ValidationFailedException(
          "user_id",
          "User ID must be 3 to 128 characters of letters, numbers, hyphens and underscores");
    }
    return userId;
  }

  /** Returns the id in lowercase, which is how generated ids are stored. */
  public String requireImageId(String imageId) {
    if (imageId == null || !UUID.matcher(imageId.trim()).matches()) {
      throw new ValidationFailedException("image_id", "Image ID must be a valid UUID");
    }
    return imageId.trim().toLowerCase(Locale.ROOT);
  }

  public String requireContentType(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      throw new ValidationFailedException("content_type", "Content type is required");
    }
    String normalized = contentType.trim().toLowerCase(Locale.ROOT);
    boolean allowed =
        properties.allowedContentTypes().stream().anyMatch(t -> t.equalsIgnoreCase(normalized));
    if (!allowed) {
      throw new ValidationFailedException(
          "content_type",
          "Content type "
              + normalized
              + " is not allowed. Allowed types: "
              + String.join(", ", properties.allowedContentTypes()));
    }
    return normalized;
  }

  public long requireFileSize(long size) {
    if (size <= 0) {
      throw new ValidationFailedException("size", "File size must be greater than 0");
    }
    if (size > properties.maxSize()) {
      throw new ValidationFailedException(
          "size", "File size exceeds maximum allowed size of " + properties.maxSize() + " bytes");
    }
    return size;
  }

  public List<String> requireTags(List<String> tags) {
    if (tags == null) {
      return List.of();
    }
    if (tags.size() > MAX_TAGS) {
      throw new ValidationFailedException("tags", "Maximum " + MAX_TAGS + " tags allowed");
    }
    List<String> result = new ArrayList<>(tags.size());
    for (String tag : tags) {
      if (tag == null || tag.isBlank()) {
        throw new ValidationFailedException("tags", "Tags cannot be empty");
      }
      if (tag.length() > MAX_TAG_LENGTH) {
        throw new ValidationFailedException(
            "tags", "Tags cannot exceed " + MAX_TAG_LENGTH + " characters");
      }
      if (!TAG.matcher(tag).matches()) {
        throw new ValidationFailedException(
            "tags", "Tag '" + tag + "' contains invalid characters");
      }
      result.add(tag.trim());
    }
    return List.copyOf(result);
  }

  /** Splits a comma separated tag filter, dropping empty entries, then applies the tag rules. */
  public List<String> parseTagFilter(String csv) {
    if (csv == null || csv.isBlank()) {
      return List.of();
    }
    List<String> tags =
        Arrays.stream(csv.split(",")).map(String::trim).filter(t -> !t.isEmpty()).toList();
    return requireTags(tags);
  }

  public String requireDescription(String description) {
    if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
      throw new ValidationFailedException(
          "description",
          "Description cannot exceed " + MAX_DESCRIPTION_LENGTH + " characters");
    }
    return description;
  }

  public Integer requirePositive(String field, Integer value) {
    if (value != null && value <= 0) {
      throw new ValidationFailedException(field, field + " must be a positive integer");
    }
    return value;
  }

  public ImageStatus parseStatus(String value) {
    return ImageStatus.fromValue(value)
        .orElseThrow(
            () ->
                new ValidationFailedException(
                    "status",
                    "Invalid status. Must be one of: processing, active, error, deleted"));
  }

  /** Requested lifetime in seconds, defaulted when absent and capped at the configured maximum. */
  public Duration resolveExpiry(Integer seconds) {
    if (seconds == null) {
      return properties.defaultUrlExpiry();
    }
    if (seconds <= 0) {
      throw new ValidationFailedException("expiry", "Expiry must be a positive number of seconds");
    }
    Duration requested = Duration.ofSeconds(seconds);
    return requested.compareTo(properties.maxUrlExpiry()) > 0
        ? properties.maxUrlExpiry()
        : requested;
  }

  public int resolvePageSize(Integer limit) {
    if (limit == null) {
      return properties.defaultPageSize();
    }
    return Math.max(1, Math.min(limit, properties.maxPageSize()));
  }

  /**
   * Makes a client-supplied filename safe to embed in an object key: path components are dropped,
   * reserved and control characters become underscores, and overlong names are cut while keeping
   * the extension.
   */
  public static String sanitizeFilename(String filename) {
    if (filename == null || filename.isEmpty()) {
      return "unnamed";
    }
    String name = filename.substring(filename.lastIndexOf('/') + 1);
    name = name.substring(name.lastIndexOf('\\') + 1);
    name = UNSAFE_FILENAME_CHARS.matcher(name).replaceAll("_");
    name = stripSpacesAndDots(name);

    if (name.length() > MAX_FILENAME_LENGTH) {
      int dot = name.lastIndexOf('.');
      String ext = dot >= 0 ? name.substring(dot + 1) : "";
      if (!ext.isEmpty() && ext.length() < MAX_FILENAME_LENGTH - 1) {
        name = name.substring(0, MAX_FILENAME_LENGTH - ext.length() - 1) + "." + ext;
      } else {
        name = name.substring(0, MAX_FILENAME_LENGTH);
      }
    }
    return name.isEmpty() ? "unnamed" : name;
  }

  private static String stripSpacesAndDots(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && isSpaceOrDot(value.charAt(start))) {
      start++;
    }
    while (end > start && isSpaceOrDot(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(start, end);
  }

  private static boolean isSpaceOrDot(char c) {
    return c == ' ' || c == '.';
  }
}
