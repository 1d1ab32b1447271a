package com.scholary.recipe.media.api;

import com.scholary.recipe.media.asset.MediaAsset;
import com.scholary.recipe.media.service.MediaAssetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for media uploads.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Issuing one-time image and video upload targets
 *   <li>Confirming images and polling videos after the client transferred the file
 *   <li>Reading, listing and deleting the caller's assets
 * </ul>
 *
 * <p>The caller is identified by the {@code X-User-Id} header, which the authenticating gateway
 * sets after validating the bearer token.
 */
@RestController
@RequestMapping("/api/media")
@Tag(name = "Media", description = "Image and video upload pipeline")
public class MediaController {

  static final String USER_HEADER = "X-User-Id";

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaController.class);

  private final MediaAssetService mediaAssetService;

  public MediaController(MediaAssetService mediaAssetService) {
    this.mediaAssetService = mediaAssetService;
  }

  @PostMapping("/upload/image")
  @Operation(
      summary = "Request an image upload target",
      description =
          "Creates a pending image asset and returns a one-time URL the client sends the file to. "
              + "Call confirm once the transfer finished.")
  public ResponseEntity<UploadTargetResponse> requestImageUpload(
      @RequestHeader(USER_HEADER) String userId, @Valid @RequestBody ImageUploadRequest request) {
    LOGGER.info(
        "Image upload requested: user={}, context={}, fileSize={}",
        userId,
        request.context().value(),
        request.fileSize());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(mediaAssetService.createImageUpload(userId, request));
  }

  @PostMapping("/upload/video")
  @Operation(
      summary = "Request a video upload target",
      description =
          "Creates a pending video asset and returns a one-time URL. When fileSize is given the "
              + "target may be resumable (protocol tus).")
  public ResponseEntity<UploadTargetResponse> requestVideoUpload(
      @RequestHeader(USER_HEADER) String userId, @Valid @RequestBody VideoUploadRequest request) {
    LOGGER.info(
        "Video upload requested: user={}, context={}, fileSize={}, maxDurationSeconds={}",
        userId,
        request.context().value(),
        request.fileSize(),
        request.maxDurationSeconds());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(mediaAssetService.createVideoUpload(userId, request));
  }

  @PostMapping("/{id}/confirm")
  @Operation(
      summary = "Confirm an uploaded image",
      description = "Checks the image with the provider and marks the asset ready or error.")
  public ResponseEntity<AssetResponse> confirmImage(
      @RequestHeader(USER_HEADER) String userId, @PathVariable("id") String assetId) {
    MediaAsset asset = mediaAssetService.confirmImageUpload(userId, assetId);
    return ResponseEntity.ok(new AssetResponse(asset));
  }

  @PostMapping("/{id}/poll")
  @Operation(
      summary = "Poll video processing",
      description = "Asks the provider for the video's processing state and updates the asset.")
  public ResponseEntity<AssetResponse> pollVideo(
      @RequestHeader(USER_HEADER) String userId, @PathVariable("id") String assetId) {
    MediaAsset asset = mediaAssetService.pollVideoStatus(userId, assetId);
    return ResponseEntity.ok(new AssetResponse(asset));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get a media asset")
  public ResponseEntity<AssetResponse> getAsset(
      @RequestHeader(USER_HEADER) String userId, @PathVariable("id") String assetId) {
    return ResponseEntity.ok(new AssetResponse(mediaAssetService.getOwned(userId, assetId)));
  }

  @GetMapping
  @Operation(summary = "List the caller's media assets, newest first")
  public ResponseEntity<AssetListResponse> listAssets(@RequestHeader(USER_HEADER) String userId) {
    return ResponseEntity.ok(new AssetListResponse(mediaAssetService.listForUser(userId)));
  }

  @DeleteMapping("/{id}")
  @Operation(
      summary = "Delete a media asset",
      description = "Removes the provider object (best effort) and the asset record.")
  public ResponseEntity<Void> deleteAsset(
      @RequestHeader(USER_HEADER) String userId, @PathVariable("id") String assetId) {
    mediaAssetService.delete(userId, assetId);
    return ResponseEntity.noContent().build();
  }
}
