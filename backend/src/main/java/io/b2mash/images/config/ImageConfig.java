package io.b2mash.images.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ImageConfig.ImageProperties.class)
public class ImageConfig {

  /**
   * Limits applied to image requests.
   *
   * @param maxSize largest accepted object size in bytes
   * @param allowedContentTypes MIME types accepted on upload, compared case-insensitively
   * @param defaultUrlExpiry lifetime of a presigned URL when the caller does not ask for one
   * @param maxUrlExpiry upper bound for a caller-requested URL lifetime
   * @param defaultPageSize list page size when no limit is given
   * @param maxPageSize upper bound for a caller-requested list page size
   */
  @ConfigurationProperties("images")
  public record ImageProperties(
      long maxSize,
      List<String> allowedContentTypes,
      Duration defaultUrlExpiry,
      Duration maxUrlExpiry,
      int defaultPageSize,
      int maxPageSize) {}
}
