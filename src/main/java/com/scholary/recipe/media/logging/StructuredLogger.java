package com.scholary.recipe.media.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log upload pipeline events with structured fields that can be queried in
 * the log store. Event fields are removed again after each event; the session context set through
 * {@link #setSessionContext(String, String)} stays until cleared.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log an upload session phase change. */
  public void logPhaseChanged(String sessionId, String from, String to, int progress) {
    try {
      MDC.put("event_type", "upload_phase");
      MDC.put("sessionId", sessionId);
      MDC.put("phase", to);
      MDC.put("progress", String.valueOf(progress));

      logger.debug(
          "Upload phase: session={}, {} -> {}, progress={}%", sessionId, from, to, progress);
    } finally {
      clearEventFields();
    }
  }

  /** Log a finished upload. */
  public void logUploadReady(String sessionId, String assetId, String assetType) {
    try {
      MDC.put("event_type", "upload_ready");
      MDC.put("sessionId", sessionId);
      MDC.put("assetId", assetId);

      logger.info("Upload ready: session={}, asset={}, type={}", sessionId, assetId, assetType);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed upload. */
  public void logUploadFailed(String sessionId, String errorKind, String message) {
    try {
      MDC.put("event_type", "upload_failed");
      MDC.put("sessionId", sessionId);
      MDC.put("errorType", errorKind);

      logger.warn("Upload failed: session={}, kind={}, message={}", sessionId, errorKind, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log one processing poll. */
  public void logPollAttempt(String assetId, int attempt, int maxAttempts, String status) {
    try {
      MDC.put("event_type", "processing_poll");
      MDC.put("assetId", assetId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));

      logger.debug(
          "Processing poll: asset={}, attempt={}/{}, status={}",
          assetId,
          attempt,
          maxAttempts,
          status);
    } finally {
      clearEventFields();
    }
  }

  /** Log one acknowledged chunk of a resumable transfer. */
  public void logChunkTransferred(long offset, long totalBytes) {
    try {
      MDC.put("event_type", "transfer_chunk");
      MDC.put("offset", String.valueOf(offset));
      MDC.put("totalBytes", String.valueOf(totalBytes));

      logger.debug("Transfer chunk acknowledged: offset={}/{}", offset, totalBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log a resumable transfer picking up again after an interruption. */
  public void logTransferResume(int attempt, int maxAttempts, long offset, String reason) {
    try {
      MDC.put("event_type", "transfer_resume");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("offset", String.valueOf(offset));

      logger.warn(
          "Transfer resume: attempt={}/{}, offset={}, reason={}",
          attempt,
          maxAttempts,
          offset,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a server-side asset status change. */
  public void logAssetStatus(String assetId, String from, String to) {
    try {
      MDC.put("event_type", "asset_status");
      MDC.put("assetId", assetId);
      MDC.put("phase", to);

      logger.info("Asset status: asset={}, {} -> {}", assetId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Set upload session context in MDC. */
  public static void setSessionContext(String sessionId, String assetId) {
    MDC.put("sessionId", sessionId);
    if (assetId != null) {
      MDC.put("assetId", assetId);
    }
  }

  /** Clear upload session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("sessionId");
    MDC.remove("assetId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("phase");
    MDC.remove("progress");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("offset");
    MDC.remove("totalBytes");
    MDC.remove("errorType");
  }
}
