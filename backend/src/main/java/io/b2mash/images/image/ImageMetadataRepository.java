package io.b2mash.images.image;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.model.Page;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Image records in the images table. Every method is a single table or index call. */
@Repository
public class ImageMetadataRepository {

  private final DynamoDbTable<ImageMetadata> table;
  private final DynamoDbIndex<ImageMetadata> userIndex;

  public ImageMetadataRepository(DynamoDbTable<ImageMetadata> imageMetadataTable) {
    this.table = imageMetadataTable;
    this.userIndex = imageMetadataTable.index(ImageMetadata.USER_INDEX);
  }

  public Optional<ImageMetadata> findById(String imageId) {
    return Optional.ofNullable(table.getItem(Key.builder().partitionValue(imageId).build()));
  }

  public ImageMetadata save(ImageMetadata image) {
    table.putItem(image);
    return image;
  }

  public void deleteById(String imageId) {
    table.deleteItem(Key.builder().partitionValue(imageId).build());
  }

  /**
   * Reads one page of the owner's images, newest first. Filters are applied by the table after the
   * page limit, so a page can hold fewer items than the limit while more pages remain.
   */
  public ImagePage findByUser(ImageQuery query) {
    var request =
        QueryEnhancedRequest.builder()
            .queryConditional(
                QueryConditional.keyEqualTo(Key.builder().partitionValue(query.userId()).build()))
            .scanIndexForward(false)
            .limit(query.limit());

    var filter = buildFilter(query);
    if (filter != null) {
      request.filterExpression(filter);
    }
    if (query.startKey() != null && !query.startKey().isEmpty()) {
      request.exclusiveStartKey(toAttributeValues(query.startKey()));
    }

    Page<ImageMetadata> page = userIndex.query(request.build()).iterator().next();
    return new ImagePage(List.copyOf(page.items()), fromAttributeValues(page.lastEvaluatedKey()));
  }

  static Expression buildFilter(ImageQuery query) {
    List<String> conditions = new ArrayList<>();
    Map<String, String> names = new HashMap<>();
    Map<String, AttributeValue> values = new HashMap<>();

    if (query.status() != null) {
      names.put("#status", "status");
      values.put(":status", AttributeValue.fromS(query.status().value()));
      conditions.add("#status = :status");
    }
    if (!query.tags().isEmpty()) {
      names.put("#tags", "tags");
      List<String> anyTag = new ArrayList<>();
      for (int i = 0; i < query.tags().size(); i++) {
        values.put(":tag" + i, AttributeValue.fromS(query.tags().get(i)));
        anyTag.add("contains(#tags, :tag" + i + ")");
      }
      conditions.add("(" + String.join(" OR ", anyTag) + ")");
    }
    if (query.contentType() != null) {
      names.put("#content_type", "content_type");
      values.put(":content_type", AttributeValue.fromS(query.contentType()));
      conditions.add("#content_type = :content_type");
    }
    if (query.minSize() != null) {
      names.put("#size", "size");
      values.put(":min_size", AttributeValue.fromN(String.valueOf(query.minSize())));
      conditions.add("#size >= :min_size");
    }
    if (query.maxSize() != null) {
      names.put("#size", "size");
      values.put(":max_size", AttributeValue.fromN(String.valueOf(query.maxSize())));
      conditions.add("#size <= :max_size");
    }

    if (conditions.isEmpty()) {
      return null;
    }
    return Expression.builder()
        .expression(String.join(" AND ", conditions))
        .expressionNames(names)
        .expressionValues(values)
        .build();
  }

  // Keys of the table and UserIndex are all string attributes.
  private static Map<String, AttributeValue> toAttributeValues(Map<String, String> key) {
    Map<String, AttributeValue> result = new HashMap<>();
    key.forEach((name, value) -> result.put(name, AttributeValue.fromS(value)));
    return result;
  }

  private static Map<String, String> fromAttributeValues(Map<String, AttributeValue> key) {
    if (key == null || key.isEmpty()) {
      return null;
    }
    Map<String, String> result = new LinkedHashMap<>();
    key.forEach((name, value) -> result.put(name, value.s()));
    return result;
  }
}
