package io.b2mash.images.storage;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.regex.Pattern;

/** Builds and checks object keys of the form {@code {userId}/{yyyyMMdd}/{suffix}_{filename}}. */
public final class StorageKeys {

  private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

  /** Validates that keys follow the expected user-scoped path structure. */
  private static final Pattern IMAGE_KEY_PATTERN =
      Pattern.compile("^[A-Za-z0-9_-]{3,128}/\\d{8}/[0-9a-f]{8}_[^/]+$");

  private StorageKeys() {}

  public static String buildImageKey(String userId, String filename, LocalDate uploadDay) {
    String suffix = UUID.randomUUID().toString().substring(0, 8);
    return buildImageKey(userId, filename, uploadDay, suffix);
  }

  static String buildImageKey(String userId, String filename, LocalDate uploadDay, String suffix) {
    return userId + "/" + DAY.format(uploadDay) + "/" + suffix + "_" + filename;
  }

  public static boolean isValidImageKey(String key) {
    return key != null && IMAGE_KEY_PATTERN.matcher(key).matches();
  }
}
