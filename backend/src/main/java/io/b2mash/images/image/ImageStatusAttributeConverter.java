package io.b2mash.images.image;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Stores {@link ImageStatus} as its lowercase value so the StatusIndex keys read naturally. */
public class ImageStatusAttributeConverter implements AttributeConverter<ImageStatus> {

  @Override
  public AttributeValue transformFrom(ImageStatus input) {
    return AttributeValue.fromS(input.value());
  }

  @Override
  public ImageStatus transformTo(AttributeValue input) {
    return ImageStatus.fromValue(input.s())
        .orElseThrow(() -> new IllegalStateException("Unknown image status: " + input.s()));
  }

  @Override
  public EnhancedType<ImageStatus> type() {
    return EnhancedType.of(ImageStatus.class);
  }

  @Override
  public AttributeValueType attributeValueType() {
    return AttributeValueType.S;
  }
}
