package io.b2mash.images.image;

import java.util.List;
import java.util.Map;

/**
 * Filters for listing one owner's images. Null fields are not applied.
 *
 * @param userId owner whose images are listed
 * @param tags matches images carrying any of these tags
 * @param contentType exact MIME type match
 * @param status exact status match
 * @param minSize inclusive lower bound on size
 * @param maxSize inclusive upper bound on size
 * @param limit maximum number of items evaluated per page
 * @param startKey exclusive start key from a previous page
 */
public record ImageQuery(
    String userId,
    List<String> tags,
    String contentType,
    ImageStatus status,
    Long minSize,
    Long maxSize,
    int limit,
    Map<String, String> startKey) {

  public ImageQuery {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
