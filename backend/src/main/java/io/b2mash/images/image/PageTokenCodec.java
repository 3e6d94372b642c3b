package io.b2mash.images.image;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.images.exception.ValidationFailedException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Turns a listing's last evaluated key into an opaque URL-safe token and back. */
@Component
public class PageTokenCodec {

  private static final TypeReference<Map<String, String>> KEY_TYPE = new TypeReference<>() {};
  private static final Set<String> KEY_ATTRIBUTES =
      Set.of("image_id", "user_id", "upload_timestamp");

  private final ObjectMapper objectMapper;

  public PageTokenCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(Map<String, String> lastKey) {
    if (lastKey == null || lastKey.isEmpty()) {
      return null;
    }
    try {
      byte[] json = objectMapper.writeValueAsBytes(lastKey);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode pagination token", e);
    }
  }

  /**
   * Decodes a token issued by {@link #encode} for {@code userId}. The key must carry exactly the
   * UserIndex key attributes and belong to the listed user.
   */
  public Map<String, String> decode(String token, String userId) {
    if (token == null || token.isBlank()) {
      return null;
    }
    Map<String, String> key;
    try {
      byte[] json = Base64.getUrlDecoder().decode(token.trim());
      key = objectMapper.readValue(new String(json, StandardCharsets.UTF_8), KEY_TYPE);
    } catch (IllegalArgumentException | JsonProcessingException e) {
      throw invalidToken();
    }
    if (key == null || !key.keySet().equals(KEY_ATTRIBUTES) || key.containsValue(null)) {
      throw invalidToken();
    }
    if (!key.get("user_id").equals(userId)) {
      throw invalidToken();
    }
    return key;
  }

  private static ValidationFailedException invalidToken() {
    return new ValidationFailedException("next_token", "Invalid pagination token");
  }
}
