package io.b2mash.images.config;

import io.b2mash.images.config.S3Config.AwsCredentialsProperties;
import io.b2mash.images.image.ImageMetadata;
import java.net.URI;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Configuration
@EnableConfigurationProperties(DynamoDbConfig.DynamoDbProperties.class)
public class DynamoDbConfig {

  @ConfigurationProperties("aws.dynamodb")
  public record DynamoDbProperties(String endpoint, String region, String tableName) {

    boolean hasEndpointOverride() {
      return endpoint != null && !endpoint.isBlank();
    }
  }

  @Bean(destroyMethod = "close")
  DynamoDbClient dynamoDbClient(DynamoDbProperties props, AwsCredentialsProperties credProps) {
    var builder =
        DynamoDbClient.builder()
            .region(Region.of(props.region()))
            .credentialsProvider(credProps.provider(props.hasEndpointOverride()));

    if (props.hasEndpointOverride()) {
      builder.endpointOverride(URI.create(props.endpoint()));
    }

    return builder.build();
  }

  @Bean
  DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
    return DynamoDbEnhancedClient.builder().dynamoDbClient(dynamoDbClient).build();
  }

  @Bean
  DynamoDbTable<ImageMetadata> imageMetadataTable(
      DynamoDbEnhancedClient enhancedClient, DynamoDbProperties props) {
    return enhancedClient.table(props.tableName(), TableSchema.fromBean(ImageMetadata.class));
  }
}
