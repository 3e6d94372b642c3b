package io.b2mash.images.image;

import java.util.List;
import java.util.Map;

/** One page of a listing. {@code lastKey} is null when there are no more pages. */
public record ImagePage(List<ImageMetadata> items, Map<String, String> lastKey) {

  public boolean hasMore() {
    return lastKey != null && !lastKey.isEmpty();
  }
}
