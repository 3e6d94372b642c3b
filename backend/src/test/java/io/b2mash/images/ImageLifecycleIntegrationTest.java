package io.b2mash.images;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.images.image.ImageMetadata;
import io.b2mash.images.storage.StorageService;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

/** Drives one image through upload, activation, download and both delete modes on LocalStack. */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class ImageLifecycleIntegrationTest {

  private static final String TEST_BUCKET = "test-images";
  private static final String TEST_TABLE = "images-test";
  private static final String USER_ID = "integration-user";
  private static final byte[] IMAGE_BYTES = "fake-png-bytes".getBytes(StandardCharsets.UTF_8);

  @Container
  static LocalStackContainer localstack =
      new LocalStackContainer(DockerImageName.parse("localstack/localstack:3.8"))
          .withServices(LocalStackContainer.Service.S3, LocalStackContainer.Service.DYNAMODB);

  @DynamicPropertySource
  static void overrideAwsProperties(DynamicPropertyRegistry registry) {
    registry.add(
        "aws.s3.endpoint",
        () -> localstack.getEndpointOverride(LocalStackContainer.Service.S3).toString());
    registry.add("aws.s3.region", localstack::getRegion);
    registry.add("aws.s3.bucket-name", () -> TEST_BUCKET);
    registry.add(
        "aws.dynamodb.endpoint",
        () -> localstack.getEndpointOverride(LocalStackContainer.Service.DYNAMODB).toString());
    registry.add("aws.dynamodb.region", localstack::getRegion);
    registry.add("aws.dynamodb.table-name", () -> TEST_TABLE);
    registry.add("aws.credentials.access-key-id", localstack::getAccessKey);
    registry.add("aws.credentials.secret-access-key", localstack::getSecretKey);
  }

  @BeforeAll
  static void createBucketAndTable() {
    var credentials =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(localstack.getAccessKey(), localstack.getSecretKey()));

    try (var s3 =
        S3Client.builder()
            .endpointOverride(localstack.getEndpointOverride(LocalStackContainer.Service.S3))
            .region(Region.of(localstack.getRegion()))
            .credentialsProvider(credentials)
            .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
            .build()) {
      s3.createBucket(CreateBucketRequest.builder().bucket(TEST_BUCKET).build());
    }

    try (var dynamo =
        DynamoDbClient.builder()
            .endpointOverride(localstack.getEndpointOverride(LocalStackContainer.Service.DYNAMODB))
            .region(Region.of(localstack.getRegion()))
            .credentialsProvider(credentials)
            .build()) {
      var throughput =
          ProvisionedThroughput.builder().readCapacityUnits(5L).writeCapacityUnits(5L).build();
      var projectAll = Projection.builder().projectionType(ProjectionType.ALL).build();
      var table =
          DynamoDbEnhancedClient.builder()
              .dynamoDbClient(dynamo)
              .build()
              .table(TEST_TABLE, TableSchema.fromBean(ImageMetadata.class));
      table.createTable(
          CreateTableEnhancedRequest.builder()
              .provisionedThroughput(throughput)
              .globalSecondaryIndices(
                  EnhancedGlobalSecondaryIndex.builder()
                      .indexName(ImageMetadata.USER_INDEX)
                      .projection(projectAll)
                      .provisionedThroughput(throughput)
                      .build(),
                  EnhancedGlobalSecondaryIndex.builder()
                      .indexName(ImageMetadata.STATUS_INDEX)
                      .projection(projectAll)
                      .provisionedThroughput(throughput)
                      .build())
              .build());
    }
  }

  @Autowired private MockMvc mockMvc;
  @Autowired private StorageService storageService;

  private final HttpClient httpClient = HttpClient.newHttpClient();

  private String createUpload(String filename) throws Exception {
    return mockMvc
        .perform(
            post("/images")
                .header("user-id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"filename": "%s", "content_type": "image/png", "tags": ["beach"]}
                    """
                        .formatted(filename)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.metadata.status").value("processing"))
        .andReturn()
        .getResponse()
        .getContentAsString();
  }

  private int put(String url, byte[] body) throws IOException, InterruptedException {
    var request =
        HttpRequest.newBuilder(URI.create(url))
            .header("Content-Type", "image/png")
            .PUT(HttpRequest.BodyPublishers.ofByteArray(body))
            .build();
    return httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
  }

  @Test
  void uploadActivateDownloadAndDelete() throws Exception {
    String created = createUpload("holiday.png");
    String imageId = JsonPath.read(created, "$.image_id");
    String uploadUrl = JsonPath.read(created, "$.upload_url");
    String s3Key = JsonPath.read(created, "$.s3_key");

    assertThat(put(uploadUrl, IMAGE_BYTES)).isEqualTo(200);

    mockMvc
        .perform(
            patch("/images/{id}", imageId)
                .header("user-id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "active", "width": 640, "height": 480}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("active"))
        .andExpect(jsonPath("$.size").value(IMAGE_BYTES.length))
        .andExpect(jsonPath("$.metadata.status_updated_at").exists());

    mockMvc
        .perform(
            get("/images")
                .header("user-id", USER_ID)
                .param("tags", "beach")
                .param("status", "active"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[?(@.image_id == '%s')]", imageId).exists());

    String download =
        mockMvc
            .perform(get("/images/{id}/download", imageId).header("user-id", USER_ID))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
    String downloadUrl = JsonPath.read(download, "$.presigned_url");
    var downloaded =
        httpClient.send(
            HttpRequest.newBuilder(URI.create(downloadUrl)).GET().build(),
            HttpResponse.BodyHandlers.ofByteArray());
    assertThat(downloaded.body()).isEqualTo(IMAGE_BYTES);

    mockMvc
        .perform(get("/images/{id}", imageId).header("user-id", "someone-else"))
        .andExpect(status().isForbidden());

    mockMvc
        .perform(delete("/images/{id}", imageId).header("user-id", USER_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.delete_type").value("soft"));
    mockMvc
        .perform(get("/images/{id}", imageId).header("user-id", USER_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("deleted"));
    mockMvc
        .perform(get("/images/{id}/download", imageId).header("user-id", USER_ID))
        .andExpect(status().isGone());
    assertThat(storageService.objectSize(s3Key)).isPresent();

    mockMvc
        .perform(
            delete("/images/{id}", imageId)
                .header("user-id", USER_ID)
                .param("hard_delete", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.delete_type").value("hard"));
    mockMvc
        .perform(get("/images/{id}", imageId).header("user-id", USER_ID))
        .andExpect(status().isNotFound());
    assertThat(storageService.objectSize(s3Key)).isEmpty();
  }

  @Test
  void activationWithoutUploadedObjectIsRejected() throws Exception {
    String imageId = JsonPath.read(createUpload("never-sent.png"), "$.image_id");

    mockMvc
        .perform(
            patch("/images/{id}", imageId)
                .header("user-id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"active\"}"))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(
            patch("/images/{id}", imageId)
                .header("user-id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"error\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("error"));
  }

  @Test
  void listingPagesThroughAllImages() throws Exception {
    String pagingUser = "paging-user";
    for (int i = 0; i < 3; i++) {
      mockMvc
          .perform(
              post("/images")
                  .header("user-id", pagingUser)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"filename\": \"p" + i + ".jpg\", \"content_type\": \"image/jpeg\"}"))
          .andExpect(status().isCreated());
    }

    String first =
        mockMvc
            .perform(get("/images").header("user-id", pagingUser).param("limit", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items", hasSize(2)))
            .andExpect(jsonPath("$.has_more").value(true))
            .andReturn()
            .getResponse()
            .getContentAsString();
    String token = JsonPath.read(first, "$.next_token");

    mockMvc
        .perform(
            get("/images")
                .header("user-id", pagingUser)
                .param("limit", "2")
                .param("next_token", token))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items", hasSize(1)));

    mockMvc
        .perform(get("/images").header("user-id", pagingUser).param("next_token", "bogus!"))
        .andExpect(status().isUnprocessableEntity());
  }
}
