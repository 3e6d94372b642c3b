package io.b2mash.images.image;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Image endpoints. The caller is identified by the {@code user-id} header set by the gateway in
 * front of the service; field validation happens in {@link ImageService}.
 */
@RestController
@RequestMapping("/images")
public class ImageController {

  static final String USER_HEADER = "user-id";

  private final ImageService imageService;

  public ImageController(ImageService imageService) {
    this.imageService = imageService;
  }

  @PostMapping
  public ResponseEntity<UploadInitResponse> initiateUpload(
      @RequestHeader(name = USER_HEADER, required = false) String userId,
      @Valid @RequestBody UploadInitRequest request) {
    var result =
        imageService.initiateUpload(
            userId,
            request.filename(),
            request.contentType(),
            request.tags(),
            request.description(),
            request.expiry());
    return ResponseEntity.status(HttpStatus.CREATED).body(UploadInitResponse.from(result));
  }

  @GetMapping("/{imageId}")
  public ResponseEntity<ImageResponse> getImage(
      @PathVariable String imageId,
      @RequestHeader(name = USER_HEADER, required = false) String userId) {
    return ResponseEntity.ok(ImageResponse.from(imageService.getImage(imageId, userId)));
  }

  @GetMapping
  public ResponseEntity<ImageListResponse> listImages(
      @RequestHeader(name = USER_HEADER, required = false) String callerUserId,
      @RequestParam(name = "user_id", required = false) String userId,
      @RequestParam(required = false) String tags,
      @RequestParam(name = "content_type", required = false) String contentType,
      @RequestParam(required = false) String status,
      @RequestParam(name = "min_size", required = false) Long minSize,
      @RequestParam(name = "max_size", required = false) Long maxSize,
      @RequestParam(required = false) Integer limit,
      @RequestParam(name = "next_token", required = false) String nextToken) {
    var criteria =
        new ImageService.ListCriteria(
            userId, tags, contentType, status, minSize, maxSize, limit, nextToken);
    var result = imageService.listImages(callerUserId, criteria);
    var items = result.items().stream().map(ImageResponse::from).toList();
    return ResponseEntity.ok(
        new ImageListResponse(items, items.size(), result.nextToken(), result.hasMore()));
  }

  @PatchMapping("/{imageId}")
  public ResponseEntity<ImageResponse> updateStatus(
      @PathVariable String imageId,
      @RequestHeader(name = USER_HEADER, required = false) String userId,
      @Valid @RequestBody StatusUpdateRequest request) {
    var image =
        imageService.updateStatus(
            imageId,
            userId,
            request.status(),
            request.size(),
            request.width(),
            request.height());
    return ResponseEntity.ok(ImageResponse.from(image));
  }

  @DeleteMapping("/{imageId}")
  public ResponseEntity<DeleteResponse> deleteImage(
      @PathVariable String imageId,
      @RequestHeader(name = USER_HEADER, required = false) String userId,
      @RequestParam(name = "hard_delete", defaultValue = "false") boolean hardDelete) {
    var result = imageService.deleteImage(imageId, userId, hardDelete);
    return ResponseEntity.ok(
        new DeleteResponse(result.imageId(), true, result.deleteType().value()));
  }

  @GetMapping("/{imageId}/download")
  public ResponseEntity<?> getDownloadUrl(
      @PathVariable String imageId,
      @RequestHeader(name = USER_HEADER, required = false) String userId,
      @RequestParam(required = false) Integer expiry,
      @RequestParam(defaultValue = "false") boolean redirect) {
    var result = imageService.getDownloadUrl(imageId, userId, expiry);
    if (redirect) {
      return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(result.url())).build();
    }
    return ResponseEntity.ok(
        new DownloadResponse(
            result.url(), result.imageId(), result.expiresInSeconds(), result.expiresAt()));
  }

  public record UploadInitRequest(
      @NotBlank(message = "filename is required") String filename,
      @NotBlank(message = "content_type is required") String contentType,
      List<String> tags,
      String description,
      Integer expiry) {}

  public record StatusUpdateRequest(
      @NotBlank(message = "status is required") String status,
      Long size,
      Integer width,
      Integer height) {}

  public record UploadInitResponse(
      String imageId,
      String uploadUrl,
      String s3Key,
      long expirySeconds,
      Instant expiresAt,
      String uploadMethod,
      Map<String, String> headers,
      ImageResponse metadata) {

    public static UploadInitResponse from(ImageService.UploadInitResult result) {
      return new UploadInitResponse(
          result.image().getImageId(),
          result.uploadUrl(),
          result.image().getS3Key(),
          result.expiresInSeconds(),
          result.expiresAt(),
          "PUT",
          result.headers(),
          ImageResponse.from(result.image()));
    }
  }

  public record ImageListResponse(
      List<ImageResponse> items, int count, String nextToken, boolean hasMore) {}

  public record DeleteResponse(String imageId, boolean deleted, String deleteType) {}

  public record DownloadResponse(
      String presignedUrl, String imageId, long expirySeconds, Instant expiresAt) {}

  public record ImageResponse(
      String imageId,
      String userId,
      String filename,
      String contentType,
      long size,
      String s3Bucket,
      String s3Key,
      Instant uploadTimestamp,
      List<String> tags,
      String description,
      Integer width,
      Integer height,
      String status,
      Map<String, String> metadata) {

    public static ImageResponse from(ImageMetadata image) {
      return new ImageResponse(
          image.getImageId(),
          image.getUserId(),
          image.getFilename(),
          image.getContentType(),
          image.getSize(),
          image.getS3Bucket(),
          image.getS3Key(),
          image.getUploadTimestamp(),
          image.getTags() != null ? image.getTags() : List.of(),
          image.getDescription(),
          image.getWidth(),
          image.getHeight(),
          image.getStatus() != null ? image.getStatus().value() : null,
          image.getMetadata() != null ? image.getMetadata() : Map.of());
    }
  }
}
