package io.b2mash.images.image;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle of an image record. Uploads start in {@link #PROCESSING} and move to {@link #ACTIVE}
 * or {@link #ERROR}; any status may be soft-deleted, and {@link #DELETED} is terminal.
 */
public enum ImageStatus {
  PROCESSING("processing"),
  ACTIVE("active"),
  ERROR("error"),
  DELETED("deleted");

  private final String value;

  ImageStatus(String value) {
    this.value = value;
  }

  /** Wire and storage representation. */
  public String value() {
    return value;
  }

  /** Whether a status update request may target this status (deletion has its own endpoint). */
  public boolean isUpdatable() {
    return this != DELETED;
  }

  public boolean canTransitionTo(ImageStatus target) {
    if (this == DELETED) {
      return false;
    }
    if (target == DELETED || target == this) {
      return true;
    }
    return this == PROCESSING && (target == ACTIVE || target == ERROR);
  }

  public static Optional<ImageStatus> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(s -> s.value.equalsIgnoreCase(value.trim())).findFirst();
  }
}
